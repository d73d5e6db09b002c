package tech.authkit.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store held in memory. Nothing survives the process.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public void put(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void deleteAll() {
        entries.clear();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
