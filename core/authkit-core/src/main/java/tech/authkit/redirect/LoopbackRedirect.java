package tech.authkit.redirect;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Captures the authorization redirect with a local HTTP listener.
 *
 * <p>The redirect URI must be an {@code http} URI on a loopback host, e.g.
 * {@code http://127.0.0.1:8765/callback}. The listener is bound to that host
 * and port, the authorization URL is opened with the {@link BrowserLauncher},
 * and the first request to the redirect path decides the outcome:
 * <ul>
 *   <li>{@code code} present - {@link RedirectOutcome.Callback}</li>
 *   <li>{@code error=access_denied} - {@link RedirectOutcome.Cancelled}</li>
 *   <li>any other {@code error} - {@link RedirectOutcome.Failed}</li>
 * </ul>
 * The listener stops as soon as the outcome future completes, whoever completes it.
 */
public class LoopbackRedirect implements InteractiveRedirect {

    private static final Logger LOG = Logger.getLogger(LoopbackRedirect.class);

    private static final Set<String> LOOPBACK_HOSTS = Set.of("127.0.0.1", "localhost", "[::1]", "::1");

    private final BrowserLauncher browserLauncher;

    public LoopbackRedirect() {
        this(new DesktopBrowserLauncher());
    }

    public LoopbackRedirect(BrowserLauncher browserLauncher) {
        this.browserLauncher = browserLauncher;
    }

    @Override
    public CompletableFuture<RedirectOutcome> authorize(RedirectRequest request) {
        CompletableFuture<RedirectOutcome> outcome = new CompletableFuture<>();

        URI redirectUri;
        try {
            redirectUri = loopbackUri(request.redirectUri());
        } catch (IllegalArgumentException e) {
            outcome.complete(new RedirectOutcome.Failed(e));
            return outcome;
        }

        HttpServer server;
        try {
            server = HttpServer.create(
                new InetSocketAddress(InetAddress.getByName(redirectUri.getHost()), redirectUri.getPort()), 0);
        } catch (IOException e) {
            LOG.errorf(e, "Could not start callback listener on %s", redirectUri);
            outcome.complete(new RedirectOutcome.Failed(e));
            return outcome;
        }

        String path = redirectUri.getPath() == null || redirectUri.getPath().isEmpty() ? "/" : redirectUri.getPath();
        ExecutorService handlerExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "authkit-callback");
            thread.setDaemon(true);
            return thread;
        });
        server.createContext(path, exchange -> handleCallback(exchange, path, redirectUri, outcome));
        server.setExecutor(handlerExecutor);
        server.start();
        LOG.infof("Callback listener started on %s", redirectUri);

        // Stopped off the handler thread: stop() waits for in-flight exchanges
        outcome.whenComplete((result, error) -> CompletableFuture.runAsync(() -> {
            server.stop(0);
            handlerExecutor.shutdown();
            LOG.infof("Callback listener on %s stopped", redirectUri);
        }));

        try {
            browserLauncher.open(request.authorizationUrl());
        } catch (IOException | RuntimeException e) {
            LOG.errorf(e, "Could not open browser, open this URL manually: %s", request.authorizationUrl());
        }
        return outcome;
    }

    private void handleCallback(HttpExchange exchange, String path, URI redirectUri,
                                CompletableFuture<RedirectOutcome> outcome) throws IOException {
        try {
            if (!path.equals(exchange.getRequestURI().getPath())) {
                sendResponse(exchange, 404, page("Not Found", ""));
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, page("Method Not Allowed", ""));
                return;
            }

            String rawQuery = exchange.getRequestURI().getRawQuery();
            Map<String, String> params = QueryParameters.parse(rawQuery);
            String error = params.get("error");
            LOG.debugf("Callback received: code=%s, error=%s",
                params.containsKey("code") ? "present" : "absent", error);

            if (params.containsKey("code") || error == null) {
                sendResponse(exchange, 200, page("Authorization Successful",
                    "You can close this window and return to the application."));
                outcome.complete(new RedirectOutcome.Callback(callbackUri(redirectUri, rawQuery)));
            } else if ("access_denied".equals(error)) {
                sendResponse(exchange, 400, page("Authorization Cancelled",
                    "The request was denied. You can close this window."));
                outcome.complete(new RedirectOutcome.Cancelled(
                    params.getOrDefault("error_description", "access denied")));
            } else {
                String description = params.getOrDefault("error_description", "Unknown error");
                sendResponse(exchange, 400, page("Authorization Failed", escape(error + ": " + description)));
                outcome.complete(new RedirectOutcome.Failed(
                    new IllegalStateException(error + ": " + description)));
            }
        } finally {
            exchange.close();
        }
    }

    private URI callbackUri(URI redirectUri, String rawQuery) {
        String base = redirectUri.toString();
        int question = base.indexOf('?');
        if (question >= 0) {
            base = base.substring(0, question);
        }
        return URI.create(rawQuery == null ? base : base + "?" + rawQuery);
    }

    static URI loopbackUri(String redirectUri) {
        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Redirect URI is not a valid URI: " + redirectUri, e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null
            || !LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                "Loopback redirect requires an http://127.0.0.1 or http://localhost redirect URI, got " + redirectUri);
        }
        if (uri.getPort() <= 0) {
            throw new IllegalArgumentException("Loopback redirect URI must name a port: " + redirectUri);
        }
        return uri;
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String html) throws IOException {
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=UTF-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private String page(String title, String message) {
        return String.format("""
            <!DOCTYPE html>
            <html>
            <head><title>%1$s</title></head>
            <body style="font-family: sans-serif; text-align: center; padding: 50px;">
                <h1>%1$s</h1>
                <p>%2$s</p>
            </body>
            </html>
            """, title, message);
    }

    private String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
