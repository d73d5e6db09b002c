package tech.authkit.session;

/**
 * Where an {@link AuthSession} is in the login flow.
 */
public enum AuthPhase {
    IDLE,
    AWAITING_REDIRECT,
    EXCHANGING_CODE,
    RESOLVING_IDENTITY,
    AUTHENTICATED,
    FAILED;

    /**
     * Whether a login attempt ends in this phase.
     */
    public boolean isTerminal() {
        return this == AUTHENTICATED || this == FAILED;
    }
}
