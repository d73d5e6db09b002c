package tech.authkit.http;

import java.io.IOException;

/**
 * Issues HTTP requests on behalf of the token exchanger and identity decoder.
 *
 * <p>Implementations perform exactly one attempt per call: no retries and no
 * redirect following beyond their own defaults.
 */
public interface HttpTransport {

    /**
     * Send a request and return whatever status the server answered with.
     *
     * @throws IOException          if the server could not be reached or the exchange broke off
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    TransportResponse execute(TransportRequest request) throws IOException, InterruptedException;
}
