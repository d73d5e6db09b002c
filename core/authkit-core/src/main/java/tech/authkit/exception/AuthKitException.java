package tech.authkit.exception;

/**
 * Base exception for AuthKit errors.
 */
public class AuthKitException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthKitException(AuthErrorKind kind, String message) {
        this(kind, message, null);
    }

    public AuthKitException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : AuthErrorKind.UNEXPECTED;
    }

    public AuthErrorKind getKind() {
        return kind;
    }
}
