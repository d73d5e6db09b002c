package tech.authkit.store;

import tech.authkit.role.RoleModel;

import java.util.Optional;

/**
 * Reads and writes the persisted session record: the access token and the
 * serialized role, under two fixed keys.
 */
public class SessionRecordRepository<R> {

    public static final String TOKEN_KEY = "auth_token";
    public static final String ROLE_KEY = "user_role";

    private final CredentialStore store;
    private final RoleModel<R> roleModel;

    public SessionRecordRepository(CredentialStore store, RoleModel<R> roleModel) {
        this.store = store;
        this.roleModel = roleModel;
    }

    public void save(String token, R role) {
        String serializedRole = roleModel.serialize(role);
        store.put(TOKEN_KEY, token);
        store.put(ROLE_KEY, serializedRole);
    }

    public Optional<String> findToken() {
        return store.get(TOKEN_KEY).filter(token -> !token.isEmpty());
    }

    public Optional<R> findRole() {
        return store.get(ROLE_KEY).flatMap(roleModel::deserialize);
    }

    public void clear() {
        store.deleteAll();
    }
}
