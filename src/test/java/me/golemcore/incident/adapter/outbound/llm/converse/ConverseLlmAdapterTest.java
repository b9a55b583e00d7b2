package me.golemcore.incident.adapter.outbound.llm.converse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseContentBlock;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseMessage;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseStreamEvent;
import me.golemcore.incident.domain.conversation.ConverseHistoryNormalizer;
import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.ToolDefinition;
import me.golemcore.incident.domain.service.ToolSchemaBuilder;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConverseLlmAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private IncidentProperties properties;
    private ConverseTransport transport;
    private ConverseLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new IncidentProperties();
        properties.getLlm().getConverse().setEndpoint("https://converse.example.com");
        properties.getLlm().getConverse().setModelId("model-x");
        transport = mock(ConverseTransport.class);
        ConverseRequestEncoder encoder = new ConverseRequestEncoder(
                new ConverseHistoryNormalizer(objectMapper), new ToolSchemaBuilder(), objectMapper, properties);
        adapter = new ConverseLlmAdapter(properties, encoder, new ConverseResponseParser(objectMapper),
                new ConverseStreamDecoder(), transport);
    }

    private static LlmRequest request(List<ToolDefinition> tools) {
        return LlmRequest.builder()
                .messages(new ArrayList<>(List.of(Message.user("why is checkout failing?"))))
                .tools(tools)
                .build();
    }

    private ConverseResponse toolUseResponse() throws Exception {
        JsonNode input = objectMapper.readTree("{\"pod\":\"checkout-1\"}");
        return ConverseResponse.builder()
                .output(new ConverseResponse.Output(ConverseMessage.builder()
                        .role("assistant")
                        .content(List.of(
                                ConverseContentBlock.text("Checking."),
                                ConverseContentBlock.builder()
                                        .toolUse(new ConverseContentBlock.ToolUse("tu-1", "get_pod_logs", input))
                                        .build()))
                        .build()))
                .stopReason("tool_use")
                .usage(new ConverseResponse.TokenUsage(10, 5, 15))
                .build();
    }

    // ===== chat =====

    @Test
    void shouldSendEncodedRequestWithConfiguredModel() throws Exception {
        when(transport.converse(any())).thenReturn(toolUseResponse());

        LlmResponse response = adapter.chat(request(List.of())).join();

        ArgumentCaptor<ConverseRequest> captor = ArgumentCaptor.forClass(ConverseRequest.class);
        verify(transport).converse(captor.capture());
        assertEquals("model-x", captor.getValue().getModelId());
        assertEquals(8192, captor.getValue().getInferenceConfig().getMaxTokens());
        assertEquals(FinishReason.TOOL_CALLS, response.getFinishReason());
        assertEquals("get_pod_logs", response.getToolCalls().get(0).name());
    }

    @Test
    void shouldPropagateBackendErrorUnchanged() {
        ConverseApiException failure = ConverseApiException.fromResponse(400, "ValidationException", "bad");
        when(transport.converse(any())).thenThrow(failure);

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.chat(request(List.of())).join());

        assertSame(failure, error.getCause());
    }

    // ===== chatStream =====

    @Test
    void shouldStreamWithoutTools() {
        when(transport.converseStream(any())).thenReturn(Flux.just(
                ConverseStreamEvent.textDelta(0, "He"),
                ConverseStreamEvent.textDelta(0, "llo"),
                ConverseStreamEvent.messageStop("end_turn")));

        StepVerifier.create(adapter.chatStream(request(List.of())))
                .assertNext(chunk -> assertEquals("He", chunk.getText()))
                .assertNext(chunk -> assertEquals("llo", chunk.getText()))
                .assertNext(chunk -> assertEquals(FinishReason.STOP, chunk.getFinishReason()))
                .verifyComplete();

        verify(transport, never()).converse(any());
    }

    @Test
    void shouldReplaySingleShotResponseWhenToolsPresent() throws Exception {
        when(transport.converse(any())).thenReturn(toolUseResponse());

        StepVerifier.create(adapter.chatStream(request(List.of(ToolDefinition.simple("get_pod_logs", "logs")))))
                .assertNext(chunk -> assertEquals("Checking.", chunk.getText()))
                .assertNext(chunk -> assertEquals("tu-1", chunk.getToolCall().callId()))
                .assertNext(chunk -> {
                    assertTrue(chunk.isDone());
                    assertEquals(FinishReason.TOOL_CALLS, chunk.getFinishReason());
                    assertEquals(15, chunk.getUsage().getTotalTokens());
                })
                .verifyComplete();

        verify(transport, never()).converseStream(any());
    }

    @Test
    void shouldNotCallBackendUntilSubscribed() {
        adapter.chatStream(request(List.of()));

        verifyNoInteractions(transport);
    }

    // ===== metadata =====

    @Test
    void shouldReportAvailabilityFromConfig() {
        assertTrue(adapter.isAvailable());
        assertEquals("converse", adapter.getProviderId());
        assertEquals(List.of("model-x"), adapter.getSupportedModels());
        assertTrue(adapter.supportsStreaming());

        properties.getLlm().getConverse().setEndpoint(" ");

        assertFalse(adapter.isAvailable());
    }
}
