package tech.authkit.session;

import tech.authkit.exception.AuthErrorKind;

/**
 * Immutable snapshot of an {@link AuthSession}, as seen by listeners and callers.
 *
 * <p>The access token is deliberately not part of the snapshot.
 *
 * @param phase         current step of the login flow
 * @param loggedIn      whether a token is held
 * @param loading       whether a login attempt is running
 * @param lastError     message of the last failed attempt, {@code null} if none
 * @param lastErrorKind classification of {@code lastError}, {@code null} if none
 * @param role          current role, the guest role when logged out
 */
public record SessionState<R>(
    AuthPhase phase,
    boolean loggedIn,
    boolean loading,
    String lastError,
    AuthErrorKind lastErrorKind,
    R role
) {

    static <R> SessionState<R> initial(R guest) {
        return new SessionState<>(AuthPhase.IDLE, false, false, null, null, guest);
    }

    static <R> SessionState<R> restored(R role) {
        return new SessionState<>(AuthPhase.AUTHENTICATED, true, false, null, null, role);
    }

    SessionState<R> loginStarted() {
        return new SessionState<>(AuthPhase.AWAITING_REDIRECT, loggedIn, true, null, null, role);
    }

    SessionState<R> inPhase(AuthPhase next) {
        return new SessionState<>(next, loggedIn, loading, lastError, lastErrorKind, role);
    }

    SessionState<R> authenticated(R newRole) {
        return new SessionState<>(AuthPhase.AUTHENTICATED, true, false, null, null, newRole);
    }

    SessionState<R> failed(AuthErrorKind kind, String message) {
        return new SessionState<>(AuthPhase.FAILED, loggedIn, false, message, kind, role);
    }

    SessionState<R> loggedOut(R guest) {
        return new SessionState<>(AuthPhase.IDLE, false, loading, lastError, lastErrorKind, guest);
    }
}
