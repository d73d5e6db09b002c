package tech.authkit.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import tech.authkit.store.CredentialStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for AuthKit.
 *
 * <p>Configure in application.properties:
 * <pre>
 * authkit.provider.authorization-endpoint=https://accounts.example.com/o/oauth2/auth
 * authkit.provider.token-endpoint=https://accounts.example.com/token
 * authkit.provider.userinfo-endpoint=https://accounts.example.com/userinfo
 * authkit.provider.client-id=your_client_id
 * authkit.provider.redirect-uri=http://127.0.0.1:8765/callback
 * authkit.provider.scope=openid email profile
 * </pre>
 */
@ConfigMapping(prefix = "authkit")
public interface AuthKitConfig {

    /**
     * Identity provider endpoints and client registration.
     */
    ProviderConfig provider();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    /**
     * Interactive redirect configuration.
     */
    RedirectConfig redirect();

    /**
     * Credential store configuration.
     */
    StoreConfig store();

    interface ProviderConfig {

        @WithName("authorization-endpoint")
        String authorizationEndpoint();

        @WithName("token-endpoint")
        String tokenEndpoint();

        @WithName("userinfo-endpoint")
        String userInfoEndpoint();

        @WithName("client-id")
        String clientId();

        /**
         * Omit for public clients.
         */
        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("redirect-uri")
        String redirectUri();

        /**
         * Space-separated scopes.
         */
        Optional<String> scope();
    }

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Connect timeout in seconds.
         */
        @WithName("connect-timeout")
        @WithDefault("10")
        int connectTimeout();
    }

    interface RedirectConfig {
        /**
         * How long to wait for the user to finish authorizing.
         */
        @WithDefault("PT5M")
        Duration timeout();

        /**
         * Open the system browser; when false the URL is only logged.
         */
        @WithName("open-browser")
        @WithDefault("true")
        boolean openBrowser();
    }

    interface StoreConfig {
        @WithDefault("FILE")
        CredentialStore.StoreType type();

        /**
         * Credential file for the FILE store. Defaults to ~/.authkit/credentials.properties.
         */
        Optional<String> path();
    }
}
