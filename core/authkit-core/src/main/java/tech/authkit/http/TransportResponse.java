package tech.authkit.http;

import java.nio.charset.StandardCharsets;

/**
 * Status and raw body of an HTTP response.
 */
public record TransportResponse(int statusCode, byte[] body) {

    public TransportResponse {
        body = body != null ? body : new byte[0];
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
