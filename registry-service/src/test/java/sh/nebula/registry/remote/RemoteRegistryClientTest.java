package sh.nebula.registry.remote;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistration;
import sh.nebula.registry.MutableClock;
import sh.nebula.registry.config.RemoteSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Remote registry client")
class RemoteRegistryClientTest {

    private static final String PATH = "/api/registry";
    private static final Instant NOW = Instant.parse("2026-04-02T10:00:00Z");

    private WireMockServer server;
    private RemoteRegistryClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        client = clientWithToken("secret-token");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private RemoteRegistryClient clientWithToken(String token) {
        RemoteSettings settings = new RemoteSettings(server.baseUrl() + PATH, token, Duration.ofSeconds(2));
        return new RemoteRegistryClient(settings, HealthPolicy.defaults(), new MutableClock(NOW));
    }

    private void stubGet(String query, String value, String body) {
        server.stubFor(get(urlPathEqualTo(PATH))
                .withQueryParam(query, equalTo(value))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Test
    @DisplayName("Register posts the registration with a bearer token")
    void registerPostsBody() {
        server.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(200).withBody("{\"success\":true}")));

        boolean registered = client.register(ServiceRegistration.of("agent", List.of("wol"), "http://10.0.0.9:9765")
                .withMetadata("environment", "windows-vm"));

        assertThat(registered).isTrue();
        server.verify(postRequestedFor(urlPathEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer secret-token"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(matchingJsonPath("$.action", equalTo("register")))
                .withRequestBody(matchingJsonPath("$.name", equalTo("agent")))
                .withRequestBody(matchingJsonPath("$.endpoint", equalTo("http://10.0.0.9:9765")))
                .withRequestBody(matchingJsonPath("$.metadata.environment", equalTo("windows-vm")))
                .withRequestBody(matchingJsonPath("$.capabilities[0]", equalTo("wol"))));
    }

    @Test
    @DisplayName("Requests omit the authorization header without a token")
    void noTokenNoHeader() {
        server.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(200).withBody("{\"success\":true}")));

        assertThat(clientWithToken(null).heartbeat("agent")).isTrue();

        server.verify(postRequestedFor(urlPathEqualTo(PATH)).withoutHeader("Authorization"));
    }

    @Test
    @DisplayName("Heartbeat and unregister send only name and action")
    void heartbeatAndUnregisterBodies() {
        server.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(200).withBody("{\"success\":true}")));

        assertThat(client.heartbeat("agent")).isTrue();
        assertThat(client.unregister("agent")).isTrue();

        server.verify(postRequestedFor(urlPathEqualTo(PATH))
                .withRequestBody(equalToJson("{\"name\":\"agent\",\"action\":\"heartbeat\"}")));
        server.verify(postRequestedFor(urlPathEqualTo(PATH))
                .withRequestBody(equalToJson("{\"name\":\"agent\",\"action\":\"unregister\"}")));
    }

    @Test
    @DisplayName("Non-2xx and unsuccessful responses count as failures")
    void failuresMapToFalse() {
        server.stubFor(post(urlPathEqualTo(PATH))
                .withRequestBody(matchingJsonPath("$.action", equalTo("register")))
                .willReturn(aResponse().withStatus(401).withBody("{\"success\":false,\"error\":\"Unauthorized\"}")));
        server.stubFor(post(urlPathEqualTo(PATH))
                .withRequestBody(matchingJsonPath("$.action", equalTo("heartbeat")))
                .willReturn(aResponse().withStatus(200).withBody("{\"success\":false}")));

        assertThat(client.register(ServiceRegistration.of("agent", List.of(), "http://x:1"))).isFalse();
        assertThat(client.heartbeat("agent")).isFalse();
    }

    @Test
    @DisplayName("Discover parses the service envelope")
    void discoverParsesService() {
        stubGet("name", "ollama", """
                {"success":true,"service":{"serviceName":"ollama","environment":"windows-vm",
                 "endpoint":"http://100.64.0.2:11434","capabilities":["ai","ollama"],
                 "lastHeartbeat":"2026-04-02T09:59:30Z","isHealthy":true,"metadata":{"gpu":"rtx"}}}
                """);

        Optional<RegisteredService> found = client.discover("ollama");

        assertThat(found).hasValueSatisfying(service -> {
            assertThat(service.environment()).isEqualTo("windows-vm");
            assertThat(service.capabilities()).containsExactly("ai", "ollama");
            assertThat(service.lastSeen()).isEqualTo(Instant.parse("2026-04-02T09:59:30Z"));
            assertThat(service.healthy()).isTrue();
            assertThat(service.metadata()).containsEntry("gpu", "rtx");
        });
    }

    @Test
    @DisplayName("Discover is empty when the server reports no match")
    void discoverMiss() {
        server.stubFor(get(urlPathEqualTo(PATH))
                .withQueryParam("name", equalTo("ghost"))
                .willReturn(aResponse().withStatus(200).withBody("{\"success\":false,\"error\":\"Service not found\"}")));

        assertThat(client.discover("ghost")).isEmpty();
    }

    @Test
    @DisplayName("Capability lookup returns every parsed entry")
    void discoverByCapability() {
        stubGet("capability", "ai", """
                {"success":true,"services":[
                  {"serviceName":"a","endpoint":"http://a:1","capabilities":["ai"],"lastHeartbeat":"2026-04-02T09:59:50Z","isHealthy":true},
                  {"name":"b","endpoint":"http://b:1","capabilities":["ai"],"lastSeen":"2026-04-02T09:59:55Z","isHealthy":true},
                  {"endpoint":"http://nameless:1"}
                ]}
                """);

        assertThat(client.discoverByCapability("ai")).extracting(RegisteredService::name).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Full listing keeps unhealthy entries while healthy listing drops them")
    void listingFilters() {
        server.stubFor(get(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(200).withBody("""
                        {"success":true,"services":[
                          {"serviceName":"up","endpoint":"http://up:1","lastHeartbeat":"2026-04-02T09:59:50Z","isHealthy":true},
                          {"serviceName":"down","endpoint":"http://down:1","lastHeartbeat":"2026-04-01T09:00:00Z","isHealthy":false}
                        ]}
                        """)));

        assertThat(client.getAllServices()).extracting(RegisteredService::name).containsExactly("up", "down");
        assertThat(client.getHealthyServices()).extracting(RegisteredService::name).containsExactly("up");
    }

    @Test
    @DisplayName("Malformed JSON is treated as no answer")
    void malformedJson() {
        server.stubFor(get(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(200).withBody("<html>oops</html>")));

        assertThat(client.getAllServices()).isEmpty();
    }

    @Test
    @DisplayName("Unreachable registry is treated as no answer")
    void unreachable() {
        int port = server.port();
        server.stop();
        RemoteRegistryClient offline = new RemoteRegistryClient(
                new RemoteSettings("http://localhost:" + port + PATH, null, Duration.ofSeconds(1)),
                HealthPolicy.defaults(), new MutableClock(NOW));

        assertThat(offline.heartbeat("agent")).isFalse();
        assertThat(offline.discoverByCapability("ai")).isEmpty();
    }
}
