package tech.authkit.exception;

/**
 * Exception thrown when the authorization code cannot be exchanged for tokens.
 */
public class TokenExchangeException extends AuthKitException {

    public TokenExchangeException(String message) {
        super(AuthErrorKind.TOKEN_EXCHANGE_FAILED, "Token exchange failed: " + message);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(AuthErrorKind.TOKEN_EXCHANGE_FAILED, "Token exchange failed: " + message, cause);
    }

    public static TokenExchangeException unexpectedStatus(int status) {
        return new TokenExchangeException("token endpoint returned HTTP " + status);
    }

    public static TokenExchangeException malformedBody(Throwable cause) {
        return new TokenExchangeException("unreadable token response", cause);
    }

    public static TokenExchangeException missingAccessToken() {
        return new TokenExchangeException("token response did not contain an access_token");
    }

    public static TokenExchangeException transport(Throwable cause) {
        return new TokenExchangeException("transport error: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
