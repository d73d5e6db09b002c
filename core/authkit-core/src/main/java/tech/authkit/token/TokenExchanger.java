package tech.authkit.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.exception.TokenExchangeException;
import tech.authkit.http.HttpTransport;
import tech.authkit.http.TransportRequest;
import tech.authkit.http.TransportResponse;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exchanges an authorization code for tokens at the provider's token endpoint.
 *
 * <p>Single attempt: any status other than 200 fails the exchange.
 */
public class TokenExchanger {

    private static final Logger LOG = Logger.getLogger(TokenExchanger.class);

    private final HttpTransport transport;
    private final ObjectMapper objectMapper;

    public TokenExchanger(HttpTransport transport) {
        this(transport, new ObjectMapper());
    }

    public TokenExchanger(HttpTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    public TokenResponse exchange(ProviderConfiguration config, String code) {
        URI tokenEndpoint;
        try {
            tokenEndpoint = URI.create(config.tokenEndpoint());
        } catch (IllegalArgumentException e) {
            throw new TokenExchangeException("invalid token endpoint " + config.tokenEndpoint(), e);
        }
        if (!TransportRequest.isHttpUri(tokenEndpoint)) {
            throw new TokenExchangeException("invalid token endpoint " + config.tokenEndpoint());
        }

        TransportRequest request = TransportRequest.postForm(
            tokenEndpoint,
            Map.of("Accept", "application/json"),
            formBody(config, code)
        );

        TransportResponse response;
        try {
            response = transport.execute(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TokenExchangeException.transport(e);
        } catch (IOException e) {
            throw TokenExchangeException.transport(e);
        }

        if (response.statusCode() != 200) {
            LOG.warnf("Token endpoint %s returned %d", tokenEndpoint, response.statusCode());
            throw TokenExchangeException.unexpectedStatus(response.statusCode());
        }

        TokenResponse tokens;
        try {
            tokens = objectMapper.readValue(response.body(), TokenResponse.class);
        } catch (IOException e) {
            throw TokenExchangeException.malformedBody(e);
        }

        if (tokens == null || tokens.accessToken() == null || tokens.accessToken().isBlank()) {
            throw TokenExchangeException.missingAccessToken();
        }

        LOG.debugf("Token exchange succeeded (id_token %s)",
            tokens.identityToken().isPresent() ? "present" : "absent");
        return tokens;
    }

    private String formBody(ProviderConfiguration config, String code) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("client_id", config.clientId());
        fields.put("code", code);
        fields.put("grant_type", "authorization_code");
        fields.put("redirect_uri", config.redirectUri());
        config.secret().ifPresent(secret -> fields.put("client_secret", secret));

        return fields.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
