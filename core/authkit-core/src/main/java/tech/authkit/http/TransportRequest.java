package tech.authkit.http;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single outbound HTTP request.
 *
 * @param method  HTTP method
 * @param uri     target URI
 * @param headers request headers, in insertion order
 * @param body    request body, or {@code null} for none
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, String body) {

    public TransportRequest {
        headers = headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
            : Map.of();
    }

    public static TransportRequest get(URI uri, Map<String, String> headers) {
        return new TransportRequest("GET", uri, headers, null);
    }

    public static TransportRequest postForm(URI uri, Map<String, String> headers, String formBody) {
        Map<String, String> all = new LinkedHashMap<>(headers);
        all.put("Content-Type", "application/x-www-form-urlencoded");
        return new TransportRequest("POST", uri, all, formBody);
    }

    /**
     * Whether {@code uri} is an absolute {@code http} or {@code https} URI with a host.
     */
    public static boolean isHttpUri(URI uri) {
        String scheme = uri.getScheme();
        return scheme != null
            && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
            && uri.getHost() != null;
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
