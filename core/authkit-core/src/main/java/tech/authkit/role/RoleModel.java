package tech.authkit.role;

import java.util.Optional;

/**
 * Describes an application role type to AuthKit.
 *
 * <p>AuthKit never looks inside a role. It only needs to compare roles
 * ({@link Object#equals}), persist them between runs and know which value
 * stands for "not logged in".
 *
 * @param <R> the application's role type
 */
public interface RoleModel<R> {

    /**
     * Role used when nobody is logged in or the stored role cannot be read.
     */
    R guest();

    /**
     * Stable text form written to the credential store.
     */
    String serialize(R role);

    /**
     * Inverse of {@link #serialize}; empty for anything it does not recognise.
     */
    Optional<R> deserialize(String value);
}
