package tech.authkit.redirect;

import java.util.concurrent.CompletableFuture;

/**
 * Runs the user-facing part of the authorization code flow.
 *
 * <p>Implementations show the authorization URL to the user (system browser,
 * embedded web view, a scripted double in tests) and complete the returned
 * future exactly once with a {@link RedirectOutcome}. If the caller completes
 * or cancels the future first (for example on timeout), implementations should
 * release whatever they hold.
 */
public interface InteractiveRedirect {

    CompletableFuture<RedirectOutcome> authorize(RedirectRequest request);
}
