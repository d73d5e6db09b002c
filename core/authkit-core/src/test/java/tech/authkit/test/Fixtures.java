package tech.authkit.test;

import tech.authkit.config.ProviderConfiguration;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public final class Fixtures {

    public static final String AUTHORIZE_PATH = "/authorize";
    public static final String TOKEN_PATH = "/token";
    public static final String USERINFO_PATH = "/userinfo";

    private Fixtures() {
    }

    public static ProviderConfiguration provider(String baseUrl) {
        return ProviderConfiguration.builder()
            .authorizationEndpoint(baseUrl + AUTHORIZE_PATH)
            .tokenEndpoint(baseUrl + TOKEN_PATH)
            .userInfoEndpoint(baseUrl + USERINFO_PATH)
            .clientId("client-123")
            .redirectUri("http://127.0.0.1:8765/callback")
            .scope("openid email")
            .build();
    }

    public static ProviderConfiguration provider() {
        return provider("https://idp.test");
    }

    /**
     * Unsigned compact token whose payload segment carries {@code claimsJson}.
     */
    public static String idToken(String claimsJson) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
        String payload = encoder.encodeToString(claimsJson.getBytes(StandardCharsets.UTF_8));
        return header + "." + payload + ".sig";
    }

    public static String tokenBody(String accessToken, String idToken) {
        if (idToken == null) {
            return "{\"access_token\":\"" + accessToken + "\",\"token_type\":\"Bearer\"}";
        }
        return "{\"access_token\":\"" + accessToken + "\",\"id_token\":\"" + idToken + "\",\"token_type\":\"Bearer\"}";
    }
}
