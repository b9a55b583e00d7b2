package me.golemcore.incident.adapter.outbound.llm.converse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseContentBlock;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseMessage;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import me.golemcore.incident.testsupport.http.OkHttpMockEngine;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpConverseTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private IncidentProperties properties;
    private HttpConverseTransport transport;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new IncidentProperties();
        properties.getLlm().getConverse().setEndpoint("https://converse.example.com");
        properties.getLlm().getConverse().setApiKey("secret");
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        transport = new HttpConverseTransport(properties, client, objectMapper);
    }

    private ConverseRequest request() {
        return ConverseRequest.builder()
                .modelId("anthropic.claude-v1:0")
                .messages(List.of(ConverseMessage.builder()
                        .role("user")
                        .content(List.of(ConverseContentBlock.text("hi")))
                        .build()))
                .inferenceConfig(ConverseRequest.InferenceConfig.builder().maxTokens(8192).build())
                .build();
    }

    // ===== converse =====

    @Test
    void shouldPostRequestAndParseResponse() throws Exception {
        engine.enqueueJson(200, """
                {"output":{"message":{"role":"assistant","content":[{"text":"hello"}]}},"stopReason":"end_turn"}
                """);

        ConverseResponse response = transport.converse(request());

        assertEquals("hello", response.getOutput().getMessage().getContent().get(0).getText());
        OkHttpMockEngine.CapturedRequest captured = engine.takeRequest();
        assertEquals("POST", captured.method());
        assertEquals("/model/anthropic.claude-v1:0/converse", captured.path());
        assertEquals("Bearer secret", captured.header("Authorization"));
        JsonNode body = objectMapper.readTree(captured.body());
        assertFalse(body.has("modelId"));
        assertEquals(8192, body.get("inferenceConfig").get("maxTokens").asInt());
        assertEquals("hi", body.get("messages").get(0).get("content").get(0).get("text").asText());
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() {
        properties.getLlm().getConverse().setApiKey(null);
        engine.enqueueJson(200, "{}");

        transport.converse(request());

        assertNull(engine.takeRequest().header("Authorization"));
    }

    @Test
    void shouldClassifyBackendErrors() {
        engine.enqueueJson(429, "{\"message\":\"Too many requests\"}",
                Headers.of("x-amzn-ErrorType", "ThrottlingException:http://internal.amazon.com/coral/"));

        ConverseApiException error = assertThrows(ConverseApiException.class, () -> transport.converse(request()));

        assertEquals(429, error.getStatus());
        assertEquals("ThrottlingException", error.getErrorCode());
        assertTrue(error.isThrottled());
        assertTrue(error.getMessage().contains("throttled"));
        assertTrue(error.getMessage().contains("Too many requests"));
    }

    @Test
    void shouldClassifyValidationError() {
        engine.enqueueJson(400, "{\"message\":\"toolConfig missing\"}",
                Headers.of("x-amzn-ErrorType", "ValidationException"));

        ConverseApiException error = assertThrows(ConverseApiException.class, () -> transport.converse(request()));

        assertEquals("Converse request rejected as invalid: toolConfig missing", error.getMessage());
    }

    @Test
    void shouldWrapIoFailure() {
        engine.enqueueFailure(new IOException("connection refused"));

        ConverseApiException error = assertThrows(ConverseApiException.class, () -> transport.converse(request()));

        assertEquals(0, error.getStatus());
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void shouldRequireEndpointAndModel() {
        assertThrows(IllegalStateException.class,
                () -> HttpConverseTransport.buildUrl(null, "/model/{modelId}/converse", "m"));
        assertThrows(IllegalStateException.class,
                () -> HttpConverseTransport.buildUrl("https://x.example.com", "/model/{modelId}/converse", " "));
        assertEquals("https://x.example.com/base/model/m/converse-stream",
                HttpConverseTransport.buildUrl("https://x.example.com/base", "/model/{modelId}/converse-stream", "m")
                        .toString());
    }

    // ===== stream =====

    @Test
    void shouldStreamNdjsonEvents() {
        engine.enqueueNdjson(List.of(
                "{\"messageStart\":{\"role\":\"assistant\"}}",
                "{\"contentBlockDelta\":{\"contentBlockIndex\":0,\"delta\":{\"text\":\"He\"}}}",
                "",
                "{\"messageStop\":{\"stopReason\":\"end_turn\"}}"));

        StepVerifier.create(transport.converseStream(request()))
                .assertNext(event -> assertEquals("assistant", event.getMessageStart().getRole()))
                .assertNext(event -> assertEquals("He", event.getContentBlockDelta().getDelta().getText()))
                .assertNext(event -> assertEquals("end_turn", event.getMessageStop().getStopReason()))
                .verifyComplete();

        assertEquals("/model/anthropic.claude-v1:0/converse-stream", engine.takeRequest().path());
    }

    @Test
    void shouldFailStreamOnBackendError() {
        engine.enqueueJson(403, "{\"message\":\"no access\"}",
                Headers.of("x-amzn-ErrorType", "AccessDeniedException"));

        StepVerifier.create(transport.converseStream(request()))
                .expectErrorMatches(e -> e instanceof ConverseApiException api && api.getStatus() == 403)
                .verify();
    }

    @Test
    void shouldFailStreamOnMalformedEvent() {
        engine.enqueueNdjson(List.of("{not json"));

        StepVerifier.create(transport.converseStream(request()))
                .expectError(ConverseApiException.class)
                .verify();
    }
}
