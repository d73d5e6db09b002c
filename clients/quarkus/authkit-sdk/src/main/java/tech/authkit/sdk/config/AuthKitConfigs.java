package tech.authkit.sdk.config;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import tech.authkit.config.ProviderConfiguration;

/**
 * Loads {@link AuthKitConfig} outside a CDI container.
 */
public final class AuthKitConfigs {

    private AuthKitConfigs() {
    }

    /**
     * Reads system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     */
    public static AuthKitConfig load() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withMapping(AuthKitConfig.class)
            .build();
        return config.getConfigMapping(AuthKitConfig.class);
    }

    public static ProviderConfiguration toProviderConfiguration(AuthKitConfig config) {
        AuthKitConfig.ProviderConfig provider = config.provider();
        return ProviderConfiguration.builder()
            .authorizationEndpoint(provider.authorizationEndpoint())
            .tokenEndpoint(provider.tokenEndpoint())
            .userInfoEndpoint(provider.userInfoEndpoint())
            .clientId(provider.clientId())
            .clientSecret(provider.clientSecret().orElse(null))
            .redirectUri(provider.redirectUri())
            .scope(provider.scope().orElse(""))
            .build();
    }
}
