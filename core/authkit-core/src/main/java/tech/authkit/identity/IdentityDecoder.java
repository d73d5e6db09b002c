package tech.authkit.identity;

import org.jboss.logging.Logger;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.exception.IdentityResolutionException;
import tech.authkit.http.HttpTransport;
import tech.authkit.http.TransportRequest;
import tech.authkit.http.TransportResponse;
import tech.authkit.token.TokenResponse;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the raw identity bytes handed to the role mapper.
 *
 * <p>Claims embedded in the ID token take precedence; the userinfo endpoint is
 * only called when there is no ID token or its payload cannot be decoded.
 */
public class IdentityDecoder {

    private static final Logger LOG = Logger.getLogger(IdentityDecoder.class);

    private final HttpTransport transport;

    public IdentityDecoder(HttpTransport transport) {
        this.transport = transport;
    }

    public byte[] resolveIdentity(ProviderConfiguration config, TokenResponse tokens) {
        Optional<byte[]> embedded = tokens.identityToken().flatMap(IdTokenPayload::decode);
        if (embedded.isPresent()) {
            LOG.debug("Using claims from ID token");
            return embedded.get();
        }

        if (tokens.identityToken().isPresent()) {
            LOG.debug("ID token payload not decodable, falling back to userinfo endpoint");
        }
        return fetchUserInfo(config, tokens.accessToken());
    }

    private byte[] fetchUserInfo(ProviderConfiguration config, String accessToken) {
        URI userInfoEndpoint;
        try {
            userInfoEndpoint = URI.create(config.userInfoEndpoint());
        } catch (IllegalArgumentException e) {
            throw new IdentityResolutionException("invalid userinfo endpoint " + config.userInfoEndpoint(), e);
        }
        if (!TransportRequest.isHttpUri(userInfoEndpoint)) {
            throw new IdentityResolutionException("invalid userinfo endpoint " + config.userInfoEndpoint());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + accessToken);
        headers.put("Accept", "application/json");

        TransportResponse response;
        try {
            response = transport.execute(TransportRequest.get(userInfoEndpoint, headers));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IdentityResolutionException.transport(e);
        } catch (IOException e) {
            throw IdentityResolutionException.transport(e);
        }

        if (response.statusCode() != 200) {
            LOG.warnf("Userinfo endpoint %s returned %d", userInfoEndpoint, response.statusCode());
            throw IdentityResolutionException.unexpectedStatus(response.statusCode());
        }
        return response.body();
    }
}
