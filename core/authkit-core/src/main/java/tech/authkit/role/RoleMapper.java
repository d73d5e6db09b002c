package tech.authkit.role;

import java.util.Optional;

/**
 * Turns raw identity data into an application role.
 *
 * <p>The bytes are either the decoded ID-token payload or the userinfo response
 * body, usually JSON. Returning empty means the identity is not acceptable and
 * fails the login with a role-mapping error.
 *
 * @param <R> the application's role type
 */
@FunctionalInterface
public interface RoleMapper<R> {

    Optional<R> map(byte[] identity);
}
