package tech.authkit.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Endpoints and client registration for one OAuth 2.0 / OIDC provider.
 *
 * <p>Example (Google):
 * <pre>{@code
 * ProviderConfiguration google = ProviderConfiguration.builder()
 *     .authorizationEndpoint("https://accounts.google.com/o/oauth2/v2/auth")
 *     .tokenEndpoint("https://oauth2.googleapis.com/token")
 *     .userInfoEndpoint("https://www.googleapis.com/oauth2/v3/userinfo")
 *     .clientId("my-client-id")
 *     .redirectUri("http://127.0.0.1:8765/callback")
 *     .scope("openid profile email")
 *     .build();
 * }</pre>
 *
 * <p>URLs are kept as text and validated when a login starts, so a bad value
 * surfaces as a failed login rather than a construction error.
 *
 * @param authorizationEndpoint URL the browser is sent to
 * @param tokenEndpoint         URL the code is exchanged at
 * @param userInfoEndpoint      URL queried for identity data when no ID token is returned
 * @param clientId              registered client identifier
 * @param clientSecret          client secret, or {@code null} for public clients
 * @param redirectUri           registered redirect URI
 * @param scope                 space-delimited scopes, may be empty
 */
public record ProviderConfiguration(
    String authorizationEndpoint,
    String tokenEndpoint,
    String userInfoEndpoint,
    String clientId,
    String clientSecret,
    String redirectUri,
    String scope
) {

    public ProviderConfiguration {
        Objects.requireNonNull(authorizationEndpoint, "authorizationEndpoint");
        Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
        Objects.requireNonNull(userInfoEndpoint, "userInfoEndpoint");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(redirectUri, "redirectUri");
        scope = scope != null ? scope : "";
    }

    /**
     * The client secret, if one is configured. An empty secret counts as none.
     */
    public Optional<String> secret() {
        if (clientSecret == null || clientSecret.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(clientSecret);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String authorizationEndpoint;
        private String tokenEndpoint;
        private String userInfoEndpoint;
        private String clientId;
        private String clientSecret;
        private String redirectUri;
        private String scope = "";

        private Builder() {
        }

        public Builder authorizationEndpoint(String authorizationEndpoint) {
            this.authorizationEndpoint = authorizationEndpoint;
            return this;
        }

        public Builder tokenEndpoint(String tokenEndpoint) {
            this.tokenEndpoint = tokenEndpoint;
            return this;
        }

        public Builder userInfoEndpoint(String userInfoEndpoint) {
            this.userInfoEndpoint = userInfoEndpoint;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public ProviderConfiguration build() {
            return new ProviderConfiguration(
                authorizationEndpoint,
                tokenEndpoint,
                userInfoEndpoint,
                clientId,
                clientSecret,
                redirectUri,
                scope
            );
        }
    }
}
