package tech.authkit.redirect;

import java.net.URI;

/**
 * Terminal result of the interactive browser step.
 */
public sealed interface RedirectOutcome permits RedirectOutcome.Callback, RedirectOutcome.Cancelled, RedirectOutcome.Failed {

    /**
     * The provider redirected back; the URI carries the query parameters.
     */
    record Callback(URI callbackUri) implements RedirectOutcome {}

    /**
     * The user dismissed or denied the request.
     */
    record Cancelled(String reason) implements RedirectOutcome {}

    /**
     * The redirect could not be captured.
     */
    record Failed(Throwable cause) implements RedirectOutcome {}
}
