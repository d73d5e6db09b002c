package tech.authkit.redirect;

import java.net.URI;

/**
 * What an {@link InteractiveRedirect} needs to run the browser step.
 *
 * @param authorizationUrl fully built authorization URL to open
 * @param callbackScheme   scheme of the redirect URI, used to recognise the callback
 * @param redirectUri      the registered redirect URI, verbatim
 */
public record RedirectRequest(URI authorizationUrl, String callbackScheme, String redirectUri) {
}
