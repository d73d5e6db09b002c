package tech.authkit.redirect;

import org.jboss.logging.Logger;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.exception.AuthKitException;
import tech.authkit.exception.AuthorizationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the interactive step of the authorization code flow.
 *
 * <p>Builds the authorization URL, hands it to the {@link InteractiveRedirect}
 * and turns the single outcome into either an authorization code or an
 * {@link AuthorizationException}:
 * <ul>
 *   <li>callback with {@code code} - the code</li>
 *   <li>callback without {@code code} - {@code MISSING_CODE}</li>
 *   <li>cancelled, failed or timed out - {@code AUTHORIZATION_CANCELLED}</li>
 *   <li>unusable endpoint or redirect URI - {@code INVALID_CONFIG}</li>
 * </ul>
 */
public class RedirectCoordinator {

    private static final Logger LOG = Logger.getLogger(RedirectCoordinator.class);

    private final InteractiveRedirect interactiveRedirect;
    private final Duration timeout;

    /**
     * @param interactiveRedirect collaborator that shows the authorization page
     * @param timeout             upper bound for the interactive step, {@code null} or zero for none
     */
    public RedirectCoordinator(InteractiveRedirect interactiveRedirect, Duration timeout) {
        this.interactiveRedirect = interactiveRedirect;
        this.timeout = timeout;
    }

    /**
     * Start the interactive step. The returned future completes once, with the
     * authorization code or exceptionally with an {@link AuthorizationException}.
     */
    public CompletableFuture<String> beginAuthorization(ProviderConfiguration config) {
        RedirectRequest request;
        try {
            request = new RedirectRequest(
                buildAuthorizationUrl(config),
                callbackScheme(config.redirectUri()),
                config.redirectUri()
            );
        } catch (AuthorizationException e) {
            return CompletableFuture.failedFuture(e);
        }

        LOG.infof("Starting authorization at %s (callback scheme %s)",
            request.authorizationUrl().getHost(), request.callbackScheme());

        CompletableFuture<RedirectOutcome> outcome;
        try {
            outcome = interactiveRedirect.authorize(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(AuthorizationException.cancelled(describe(e), e));
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            outcome.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        CompletableFuture<String> code = outcome.handle((result, error) -> {
            if (error != null) {
                throw toAuthorizationException(unwrap(error));
            }
            return extractCode(result);
        });
        // Abandoning the code future releases the redirect, e.g. stops a loopback listener
        code.whenComplete((result, error) -> {
            if (error != null && !outcome.isDone()) {
                outcome.cancel(false);
            }
        });
        return code;
    }

    /**
     * Authorization endpoint plus {@code client_id}, {@code redirect_uri},
     * {@code response_type=code} and {@code scope}.
     */
    public URI buildAuthorizationUrl(ProviderConfiguration config) {
        String endpoint = config.authorizationEndpoint();
        try {
            URI parsed = new URI(endpoint);
            if (!parsed.isAbsolute() || parsed.getHost() == null) {
                throw AuthorizationException.invalidAuthorizationUrl(endpoint);
            }
        } catch (URISyntaxException e) {
            throw AuthorizationException.invalidAuthorizationUrl(endpoint);
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", config.redirectUri());
        params.put("response_type", "code");
        params.put("scope", config.scope());

        return URI.create(QueryParameters.append(endpoint, params));
    }

    /**
     * Scheme the callback arrives on, e.g. {@code http} or {@code com.example.app}.
     */
    public String callbackScheme(String redirectUri) {
        try {
            String scheme = new URI(redirectUri).getScheme();
            if (scheme != null && !scheme.isEmpty()) {
                return scheme;
            }
        } catch (URISyntaxException e) {
            LOG.debugf("Redirect URI is not a valid URI (%s), deriving scheme from prefix", e.getReason());
        }

        int colon = redirectUri.indexOf(':');
        if (colon > 0) {
            return redirectUri.substring(0, colon);
        }
        throw AuthorizationException.invalidRedirectScheme(redirectUri);
    }

    private String extractCode(RedirectOutcome outcome) {
        if (outcome instanceof RedirectOutcome.Callback callback) {
            Map<String, String> params = QueryParameters.parse(rawQuery(callback.callbackUri()));
            String code = params.get("code");
            if (code == null || code.isEmpty()) {
                throw AuthorizationException.missingCode(providerError(params));
            }
            LOG.debug("Authorization code received");
            return code;
        }
        if (outcome instanceof RedirectOutcome.Cancelled cancelled) {
            throw AuthorizationException.cancelled(
                cancelled.reason() != null ? cancelled.reason() : "user cancelled");
        }
        if (outcome instanceof RedirectOutcome.Failed failed) {
            throw AuthorizationException.cancelled(describe(failed.cause()), failed.cause());
        }
        throw AuthorizationException.cancelled("no redirect outcome");
    }

    private String rawQuery(URI callbackUri) {
        if (callbackUri == null) {
            return null;
        }
        if (callbackUri.getRawQuery() != null) {
            return callbackUri.getRawQuery();
        }
        // Opaque URIs such as myapp:callback?code=... do not expose a query component
        String text = callbackUri.toString();
        int question = text.indexOf('?');
        if (question < 0) {
            return null;
        }
        int hash = text.indexOf('#', question);
        return hash < 0 ? text.substring(question + 1) : text.substring(question + 1, hash);
    }

    private String providerError(Map<String, String> params) {
        String error = params.get("error");
        if (error == null) {
            return null;
        }
        String description = params.get("error_description");
        return description != null ? error + ": " + description : error;
    }

    private AuthKitException toAuthorizationException(Throwable error) {
        if (error instanceof AuthKitException authKitException) {
            return authKitException;
        }
        if (error instanceof TimeoutException) {
            LOG.warnf("Interactive authorization timed out after %s", timeout);
            return AuthorizationException.cancelled("timed out after " + timeout, error);
        }
        if (error instanceof CancellationException) {
            return AuthorizationException.cancelled("authorization was cancelled", error);
        }
        return AuthorizationException.cancelled(describe(error), error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
