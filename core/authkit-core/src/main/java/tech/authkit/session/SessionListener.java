package tech.authkit.session;

/**
 * Receives every state change of an {@link AuthSession}, in order.
 *
 * <p>Called on the thread that made the change while the session is locked,
 * so implementations must return quickly and must not call back into
 * {@code login}. Hand work off to a UI thread or queue instead.
 */
@FunctionalInterface
public interface SessionListener<R> {

    void onStateChanged(SessionState<R> state);
}
