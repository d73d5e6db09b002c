package tech.authkit.exception;

/**
 * Classification of a failed login attempt.
 *
 * <p>Surfaced on {@link tech.authkit.session.SessionState#lastErrorKind()} next to the
 * human-readable message so callers can branch without parsing text.
 */
public enum AuthErrorKind {
    /** Authorization endpoint or redirect URI cannot be used. */
    INVALID_CONFIG,
    /** The user or the redirect collaborator aborted the interactive step. */
    AUTHORIZATION_CANCELLED,
    /** The callback did not carry a {@code code} parameter. */
    MISSING_CODE,
    /** Token endpoint returned a non-200 status, an unreadable body, or could not be reached. */
    TOKEN_EXCHANGE_FAILED,
    /** Userinfo endpoint returned a non-200 status or could not be reached. */
    IDENTITY_RESOLUTION_FAILED,
    /** The caller's role mapper produced no role. */
    ROLE_MAPPING_FAILED,
    /** Anything outside the taxonomy above. */
    UNEXPECTED
}
