package io.codeforesight.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.codeforesight.config.GateConfig.ReasoningSettings;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * Reasoning backend reached over an OpenAI-compatible chat-completions endpoint
 * (Groq by default) with a bearer API key.
 */
public class HttpReasoningClient implements ReasoningClient {

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponseParser parser = new ResponseParser();
    private final ReasoningSettings settings;
    private final String model;
    private final String apiKey;

    public HttpReasoningClient(ReasoningSettings settings, String model, String apiKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), settings, model, apiKey);
    }

    HttpReasoningClient(HttpClient http, ReasoningSettings settings, String model, String apiKey) {
        this.http = http;
        this.settings = settings;
        this.model = model;
        this.apiKey = apiKey;
    }

    /**
     * Creates a client for the given model, reading the API key from the configured
     * environment variable. Without a key every call fails with an authentication error.
     */
    public static ReasoningClient fromEnvironment(ReasoningSettings settings, String model) {
        String key = System.getenv(settings.apiKeyEnv());
        if (key == null || key.isBlank()) {
            return new UnconfiguredReasoningClient(settings.apiKeyEnv());
        }
        return new HttpReasoningClient(settings, model, key.trim());
    }

    @Override
    public String name() {
        return model;
    }

    @Override
    public ReasoningResponse analyze(ReasoningRequest request) throws ReasoningServiceException {
        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(settings.endpoint()))
                .timeout(Duration.ofSeconds(settings.attemptTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .header("User-Agent", "code-foresight/1.0")
                .POST(HttpRequest.BodyPublishers.ofString(payload(request)))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.TIMEOUT,
                    "Request to " + settings.endpoint() + " timed out", e);
        } catch (IOException e) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    "Request to " + settings.endpoint() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    "Interrupted while waiting for " + settings.endpoint(), e);
        }

        checkStatus(response);
        String content = content(response.body());
        return new ReasoningResponse(parser.parse(content), model);
    }

    private String payload(ReasoningRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", settings.temperature());
        body.put("max_tokens", settings.maxTokens());
        ArrayNode messages = body.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", request.prompt());
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize reasoning payload", e);
        }
    }

    private static void checkStatus(HttpResponse<String> response) throws ReasoningServiceException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String detail = "HTTP " + status + abbreviate(response.body());
        if (status == 401 || status == 403) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.AUTH, detail);
        }
        if (status == 429) {
            Duration retryAfter = response.headers().firstValue("Retry-After")
                    .flatMap(HttpReasoningClient::parseRetryAfter)
                    .orElse(null);
            throw new ReasoningServiceException(ReasoningServiceException.Kind.RATE_LIMIT, detail, retryAfter, null);
        }
        if (status == 408 || status == 504) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.TIMEOUT, detail);
        }
        throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE, detail);
    }

    private String content(String body) throws ReasoningServiceException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED,
                    "Response body is not JSON", e);
        }
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.MALFORMED, "Empty completion from " + model);
        }
        return content;
    }

    /**
     * Parses a Retry-After header given in delta-seconds. HTTP-date values are ignored.
     */
    static Optional<Duration> parseRetryAfter(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String oneLine = body.replaceAll("\\s+", " ").trim();
        return ": " + (oneLine.length() > 200 ? oneLine.substring(0, 200) + "..." : oneLine);
    }
}
