package tech.authkit.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Parsed token endpoint response.
 *
 * <p>Only {@code access_token} is required. The refresh and expiry fields are
 * parsed so callers can inspect them, but nothing in AuthKit acts on them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("id_token") String idToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn
) {

    public Optional<String> identityToken() {
        if (idToken == null || idToken.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(idToken);
    }
}
