package tech.authkit.exception;

/**
 * Exception thrown when identity data cannot be obtained from the userinfo endpoint.
 */
public class IdentityResolutionException extends AuthKitException {

    public IdentityResolutionException(String message) {
        super(AuthErrorKind.IDENTITY_RESOLUTION_FAILED, "Identity resolution failed: " + message);
    }

    public IdentityResolutionException(String message, Throwable cause) {
        super(AuthErrorKind.IDENTITY_RESOLUTION_FAILED, "Identity resolution failed: " + message, cause);
    }

    public static IdentityResolutionException unexpectedStatus(int status) {
        return new IdentityResolutionException("userinfo endpoint returned HTTP " + status);
    }

    public static IdentityResolutionException transport(Throwable cause) {
        return new IdentityResolutionException("transport error: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
