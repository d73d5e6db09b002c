package tech.authkit.exception;

/**
 * Exception thrown when the interactive authorization step cannot produce a code.
 */
public class AuthorizationException extends AuthKitException {

    public AuthorizationException(AuthErrorKind kind, String message) {
        super(kind, message);
    }

    public AuthorizationException(AuthErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static AuthorizationException invalidAuthorizationUrl(String endpoint) {
        return new AuthorizationException(AuthErrorKind.INVALID_CONFIG,
            "Invalid Auth URL: " + endpoint);
    }

    public static AuthorizationException invalidRedirectScheme(String redirectUri) {
        return new AuthorizationException(AuthErrorKind.INVALID_CONFIG,
            "Invalid Redirect URI Scheme: " + redirectUri);
    }

    public static AuthorizationException cancelled(String reason) {
        return new AuthorizationException(AuthErrorKind.AUTHORIZATION_CANCELLED,
            "Login cancelled: " + reason);
    }

    public static AuthorizationException cancelled(String reason, Throwable cause) {
        return new AuthorizationException(AuthErrorKind.AUTHORIZATION_CANCELLED,
            "Login cancelled: " + reason, cause);
    }

    public static AuthorizationException missingCode(String providerError) {
        String message = providerError == null
            ? "No code found"
            : "No code found (" + providerError + ")";
        return new AuthorizationException(AuthErrorKind.MISSING_CODE, message);
    }
}
