package tech.authkit.token;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.exception.AuthErrorKind;
import tech.authkit.exception.TokenExchangeException;
import tech.authkit.http.JdkHttpTransport;
import tech.authkit.test.Fixtures;
import tech.authkit.test.RecordingTransport;

import java.net.ConnectException;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Token endpoint exchange against a WireMock provider.
 */
class TokenExchangerTest {

    private WireMockServer wireMockServer;
    private TokenExchanger exchanger;
    private ProviderConfiguration config;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        exchanger = new TokenExchanger(new JdkHttpTransport(Duration.ofSeconds(2), Duration.ofSeconds(5)));
        config = Fixtures.provider(wireMockServer.baseUrl());
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    @DisplayName("Posts the authorization_code grant as a form and parses the tokens")
    void exchange_shouldPostFormAndParseTokens() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/token"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"access_token\":\"tok1\",\"id_token\":\"a.b.c\",\"refresh_token\":\"r1\","
                    + "\"token_type\":\"Bearer\",\"expires_in\":3600,\"scope\":\"openid\"}")));

        // When
        TokenResponse tokens = exchanger.exchange(config, "abc123");

        // Then
        assertEquals("tok1", tokens.accessToken());
        assertEquals("a.b.c", tokens.identityToken().orElseThrow());
        assertEquals("r1", tokens.refreshToken());
        assertEquals(3600L, tokens.expiresIn());
        wireMockServer.verify(postRequestedFor(urlEqualTo("/token"))
            .withHeader("Content-Type", equalTo("application/x-www-form-urlencoded"))
            .withHeader("Accept", equalTo("application/json"))
            .withRequestBody(equalTo("client_id=client-123&code=abc123&grant_type=authorization_code"
                + "&redirect_uri=http%3A%2F%2F127.0.0.1%3A8765%2Fcallback")));
    }

    @Test
    void exchange_shouldSendClientSecret_onlyWhenConfigured() {
        var transport = new RecordingTransport().respond("/token", 200, "{\"access_token\":\"t\"}");
        var recordingExchanger = new TokenExchanger(transport);

        recordingExchanger.exchange(withSecret("s3cret"), "c1");
        recordingExchanger.exchange(withSecret(""), "c2");
        recordingExchanger.exchange(withSecret(null), "c3");

        assertThat(transport.requests().get(0).body()).endsWith("&client_secret=s3cret");
        assertThat(transport.requests().get(1).body()).doesNotContain("client_secret");
        assertThat(transport.requests().get(2).body()).doesNotContain("client_secret");
    }

    @Test
    void exchange_shouldFail_whenTokenEndpointReturnsNon200() {
        wireMockServer.stubFor(post(urlEqualTo("/token"))
            .willReturn(aResponse().withStatus(401).withBody("{\"error\":\"invalid_client\"}")));

        var e = assertThrows(TokenExchangeException.class, () -> exchanger.exchange(config, "abc123"));

        assertEquals(AuthErrorKind.TOKEN_EXCHANGE_FAILED, e.getKind());
        assertEquals("Token exchange failed: token endpoint returned HTTP 401", e.getMessage());
        wireMockServer.verify(1, postRequestedFor(urlEqualTo("/token")));
    }

    @Test
    void exchange_shouldFail_whenBodyIsNotJson() {
        wireMockServer.stubFor(post(urlEqualTo("/token"))
            .willReturn(aResponse().withStatus(200).withBody("<html>oops</html>")));

        var e = assertThrows(TokenExchangeException.class, () -> exchanger.exchange(config, "abc123"));

        assertEquals(AuthErrorKind.TOKEN_EXCHANGE_FAILED, e.getKind());
        assertThat(e.getMessage()).contains("unreadable token response");
    }

    @Test
    void exchange_shouldFail_whenAccessTokenMissing() {
        wireMockServer.stubFor(post(urlEqualTo("/token"))
            .willReturn(aResponse().withStatus(200).withBody("{\"id_token\":\"a.b.c\"}")));

        var e = assertThrows(TokenExchangeException.class, () -> exchanger.exchange(config, "abc123"));

        assertThat(e.getMessage()).contains("access_token");
    }

    @Test
    void exchange_shouldFail_onTransportError() {
        var transport = new RecordingTransport().fail("/token", new ConnectException("Connection refused"));

        var e = assertThrows(TokenExchangeException.class, () -> new TokenExchanger(transport).exchange(config, "c"));

        assertEquals(AuthErrorKind.TOKEN_EXCHANGE_FAILED, e.getKind());
        assertEquals("Token exchange failed: transport error: Connection refused", e.getMessage());
        assertInstanceOf(ConnectException.class, e.getCause());
    }

    @Test
    @DisplayName("Token endpoint without an http(s) scheme is a token exchange failure, not a transport crash")
    void exchange_shouldFail_whenTokenEndpointHasNoHttpScheme() {
        var transport = new RecordingTransport().respond("/token", 200, "{\"access_token\":\"t\"}");
        var schemeless = ProviderConfiguration.builder()
            .authorizationEndpoint("https://idp.test/authorize")
            .tokenEndpoint("idp.test/token")
            .userInfoEndpoint("https://idp.test/userinfo")
            .clientId("client-123")
            .redirectUri("http://127.0.0.1:8765/callback")
            .build();

        var e = assertThrows(TokenExchangeException.class,
            () -> new TokenExchanger(transport).exchange(schemeless, "abc123"));

        assertEquals(AuthErrorKind.TOKEN_EXCHANGE_FAILED, e.getKind());
        assertEquals("Token exchange failed: invalid token endpoint idp.test/token", e.getMessage());
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void identityToken_shouldTreatBlankAsAbsent() {
        assertTrue(new TokenResponse("t", "  ", null, null, null).identityToken().isEmpty());
        assertTrue(new TokenResponse("t", null, null, null, null).identityToken().isEmpty());
    }

    private ProviderConfiguration withSecret(String secret) {
        return ProviderConfiguration.builder()
            .authorizationEndpoint("https://idp.test/authorize")
            .tokenEndpoint("https://idp.test/token")
            .userInfoEndpoint("https://idp.test/userinfo")
            .clientId("client-123")
            .clientSecret(secret)
            .redirectUri("http://127.0.0.1:8765/callback")
            .build();
    }
}
