package tech.authkit.http;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = Logger.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public JdkHttpTransport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build(), requestTimeout);
    }

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public TransportResponse execute(TransportRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri())
            .timeout(requestTimeout);

        request.headers().forEach(builder::header);

        if (request.body() != null) {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofString(request.body()));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        LOG.debugf("%s %s -> %d", request.method(), request.uri(), response.statusCode());
        return new TransportResponse(response.statusCode(), response.body());
    }
}
