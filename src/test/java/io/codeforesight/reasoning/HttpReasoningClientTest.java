package io.codeforesight.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.codeforesight.config.GateConfig;
import io.codeforesight.support.Sources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpReasoningClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private HttpServer server;
    private volatile int status;
    private volatile String responseBody;
    private volatile String retryAfter;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            if (retryAfter != null) {
                exchange.getResponseHeaders().add("Retry-After", retryAfter);
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void analyze_postsChatCompletionAndParsesFindings() throws Exception {
        reply(200, completion("{\"findings\": [{\"issue\": \"Missing authorization\", \"severity\": \"high\", \"line\": 3}]}"));

        ReasoningResponse response = client().analyze(request());

        assertThat(response.model()).isEqualTo("test-model");
        assertThat(response.findings()).extracting(ReasoningFinding::issue).containsExactly("Missing authorization");
        assertThat(authorization.get()).isEqualTo("Bearer secret-key");

        JsonNode sent = mapper.readTree(requestBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("test-model");
        assertThat(sent.path("temperature").asDouble()).isEqualTo(0.2);
        assertThat(sent.path("messages").path(0).path("role").asText()).isEqualTo("user");
        assertThat(sent.path("messages").path(0).path("content").asText()).contains("view_admin_report");
    }

    @Test
    void analyze_mapsUnauthorizedToAuth() {
        reply(401, "{\"error\": \"invalid key\"}");

        assertKind(ReasoningServiceException.Kind.AUTH);
    }

    @Test
    void analyze_mapsTooManyRequestsToRateLimitWithRetryAfter() {
        reply(429, "{}");
        retryAfter = "7";

        assertThatThrownBy(() -> client().analyze(request()))
                .isInstanceOf(ReasoningServiceException.class)
                .satisfies(e -> {
                    ReasoningServiceException rse = (ReasoningServiceException) e;
                    assertThat(rse.kind()).isEqualTo(ReasoningServiceException.Kind.RATE_LIMIT);
                    assertThat(rse.retryAfter()).contains(Duration.ofSeconds(7));
                });
    }

    @Test
    void analyze_mapsGatewayTimeoutToTimeout() {
        reply(504, "");

        assertKind(ReasoningServiceException.Kind.TIMEOUT);
    }

    @Test
    void analyze_mapsServerErrorToUnavailable() {
        reply(503, "overloaded");

        assertKind(ReasoningServiceException.Kind.UNAVAILABLE);
    }

    @Test
    void analyze_emptyCompletionIsMalformed() {
        reply(200, completion(""));

        assertKind(ReasoningServiceException.Kind.MALFORMED);
    }

    @Test
    void analyze_unreachableEndpointIsUnavailable() {
        GateConfig.ReasoningSettings closedPort = new GateConfig.ReasoningSettings(
                "http://127.0.0.1:1/v1/chat/completions", "test-model", null, "UNUSED",
                0.2, 500, 5, 1, 10, 100, 30);

        assertThatThrownBy(() -> new HttpReasoningClient(closedPort, "test-model", "k").analyze(request()))
                .isInstanceOf(ReasoningServiceException.class)
                .satisfies(e -> assertThat(((ReasoningServiceException) e).kind())
                        .isIn(ReasoningServiceException.Kind.UNAVAILABLE, ReasoningServiceException.Kind.TIMEOUT));
    }

    @Test
    void parseRetryAfter_acceptsDeltaSecondsOnly() {
        assertThat(HttpReasoningClient.parseRetryAfter("12")).contains(Duration.ofSeconds(12));
        assertThat(HttpReasoningClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isEmpty();
        assertThat(HttpReasoningClient.parseRetryAfter("-1")).isEmpty();
    }

    @Test
    void fromEnvironment_withoutKeyFailsWithAuth() {
        GateConfig.ReasoningSettings settings = settings("CODE_FORESIGHT_UNSET_KEY_FOR_TESTS");

        ReasoningClient client = HttpReasoningClient.fromEnvironment(settings, "m");

        assertThat(client).isInstanceOf(UnconfiguredReasoningClient.class);
        assertThatThrownBy(() -> client.analyze(request()))
                .isInstanceOf(ReasoningServiceException.class)
                .hasMessageContaining("CODE_FORESIGHT_UNSET_KEY_FOR_TESTS");
    }

    private void reply(int status, String body) {
        this.status = status;
        this.responseBody = body;
    }

    private String completion(String content) {
        return mapper.createObjectNode()
                .set("choices", mapper.createArrayNode().add(mapper.createObjectNode()
                        .set("message", mapper.createObjectNode()
                                .put("role", "assistant")
                                .put("content", content))))
                .toString();
    }

    private void assertKind(ReasoningServiceException.Kind kind) {
        assertThatThrownBy(() -> client().analyze(request()))
                .isInstanceOf(ReasoningServiceException.class)
                .satisfies(e -> assertThat(((ReasoningServiceException) e).kind()).isEqualTo(kind));
    }

    private HttpReasoningClient client() {
        return new HttpReasoningClient(settings("UNUSED"), "test-model", "secret-key");
    }

    private GateConfig.ReasoningSettings settings(String apiKeyEnv) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions";
        return new GateConfig.ReasoningSettings(endpoint, "test-model", null, apiKeyEnv,
                0.2, 500, 5, 1, 10, 100, 30);
    }

    private static ReasoningRequest request() {
        return new ReasoningRequest(Sources.snippet("demo.c", """
                static void view_admin_report(int is_admin) {
                    (void)is_admin;
                    printf("Admin report: all user emails...\\n");
                }""", "view_admin_report"), "", PromptTemplate.BUSINESS_LOGIC);
    }
}
