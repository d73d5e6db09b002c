package tech.authkit.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

class JdkHttpTransportTest {

    private WireMockServer wireMockServer;
    private JdkHttpTransport transport;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        transport = new JdkHttpTransport(Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    void execute_shouldSendHeadersAndReturnRawBody() throws Exception {
        wireMockServer.stubFor(get(urlEqualTo("/userinfo"))
            .withHeader("Authorization", equalTo("Bearer tok1"))
            .willReturn(aResponse().withStatus(200).withBody("{\"sub\":\"1\"}")));

        TransportResponse response = transport.execute(TransportRequest.get(
            URI.create(wireMockServer.baseUrl() + "/userinfo"), Map.of("Authorization", "Bearer tok1")));

        assertEquals(200, response.statusCode());
        assertEquals("{\"sub\":\"1\"}", response.bodyAsString());
    }

    @Test
    void execute_shouldNotFollowRedirects() throws Exception {
        wireMockServer.stubFor(get(urlEqualTo("/moved"))
            .willReturn(aResponse().withStatus(302).withHeader("Location", "/elsewhere")));

        TransportResponse response = transport.execute(TransportRequest.get(
            URI.create(wireMockServer.baseUrl() + "/moved"), Map.of()));

        assertEquals(302, response.statusCode());
        wireMockServer.verify(0, getRequestedFor(urlEqualTo("/elsewhere")));
    }

    @Test
    void execute_shouldReturnErrorStatusesWithoutThrowing() throws Exception {
        wireMockServer.stubFor(post(urlEqualTo("/token"))
            .willReturn(aResponse().withStatus(500).withBody("boom")));

        TransportResponse response = transport.execute(TransportRequest.postForm(
            URI.create(wireMockServer.baseUrl() + "/token"), Map.of(), "a=b"));

        assertEquals(500, response.statusCode());
        assertEquals("boom", response.bodyAsString());
        wireMockServer.verify(postRequestedFor(urlEqualTo("/token"))
            .withHeader("Content-Type", equalTo("application/x-www-form-urlencoded"))
            .withRequestBody(equalTo("a=b")));
    }
}
