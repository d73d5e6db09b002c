package tech.authkit.store;

import java.util.Optional;

/**
 * Durable key-value storage for session credentials.
 *
 * <p>Values are opaque strings. Implementations:
 * <ul>
 *   <li>{@link InMemoryCredentialStore} - process lifetime only, for tests and short-lived tools</li>
 *   <li>{@link FileCredentialStore} - a properties file readable by the current user only</li>
 * </ul>
 * Platform keychains can be plugged in by implementing this interface.
 */
public interface CredentialStore {

    /**
     * Store a value, replacing any previous value under the key.
     *
     * @throws tech.authkit.exception.CredentialStoreException if the value cannot be persisted
     */
    void put(String key, String value);

    /**
     * @return the stored value, or empty if there is none
     * @throws tech.authkit.exception.CredentialStoreException if the store cannot be read
     */
    Optional<String> get(String key);

    /**
     * Remove every entry.
     *
     * @throws tech.authkit.exception.CredentialStoreException if the store cannot be cleared
     */
    void deleteAll();

    /**
     * Credential store backend type.
     */
    enum StoreType {
        MEMORY,
        FILE
    }
}
