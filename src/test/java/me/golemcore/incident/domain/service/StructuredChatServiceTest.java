package me.golemcore.incident.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.incident.adapter.outbound.schema.NetworkntSchemaValidatorAdapter;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.StructuredOutput;
import me.golemcore.incident.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StructuredChatServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LlmPort llmPort;
    private StructuredChatService service;
    private JsonNode schema;

    @BeforeEach
    void setUp() throws Exception {
        llmPort = mock(LlmPort.class);
        service = new StructuredChatService(llmPort,
                new StructuredOutputInstructions(objectMapper),
                new StructuredOutputRecovery(objectMapper, new NetworkntSchemaValidatorAdapter()));
        schema = objectMapper.readTree("""
                {"type":"object","properties":{"severity":{"enum":["low","high"]}},"required":["severity"]}
                """);
    }

    @Test
    void shouldReturnRecoveredObject() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("```json\n{\"severity\":\"high\"}\n```").build()));
        List<Message> history = new ArrayList<>(List.of(Message.user("How bad is it?")));
        LlmRequest request = LlmRequest.builder().messages(history).build();

        StructuredOutput output = service.chat(request, schema).join();

        assertTrue(output.isSuccess());
        assertEquals("high", output.getValue().get("severity").asText());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String sent = captor.getValue().getMessages().get(0).getText();
        assertTrue(sent.contains("\"severity\""));
        assertEquals("How bad is it?", request.getMessages().get(0).getText());
    }

    @Test
    void shouldReturnFailureWithRawTextWhenAnswerDoesNotValidate() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("{\"severity\":\"medium\"}").build()));

        StructuredOutput output = service.chat(LlmRequest.builder().build(), schema).join();

        assertFalse(output.isSuccess());
        assertEquals(StructuredOutput.FailureKind.VALIDATION, output.getFailureKind());
        assertEquals("{\"severity\":\"medium\"}", output.getRawText());
    }
}
