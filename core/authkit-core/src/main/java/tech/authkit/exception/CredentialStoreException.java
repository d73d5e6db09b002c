package tech.authkit.exception;

/**
 * Exception thrown when the credential store cannot be read or written.
 */
public class CredentialStoreException extends AuthKitException {

    public CredentialStoreException(String message, Throwable cause) {
        super(AuthErrorKind.UNEXPECTED, message, cause);
    }

    public static CredentialStoreException readFailed(Object location, Throwable cause) {
        return new CredentialStoreException("Failed to read credentials from " + location, cause);
    }

    public static CredentialStoreException writeFailed(Object location, Throwable cause) {
        return new CredentialStoreException("Failed to write credentials to " + location, cause);
    }
}
