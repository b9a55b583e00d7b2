package me.golemcore.incident.adapter.outbound.llm;

import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldReturnPlaceholderResponse() {
        LlmResponse response = adapter.chat(LlmRequest.builder().build()).join();

        assertEquals("[No LLM configured]", response.getContent());
        assertEquals(FinishReason.STOP, response.getFinishReason());
        assertEquals(0, response.getUsage().getTotalTokens());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldStreamPlaceholderThenFinish() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .assertNext(chunk -> assertEquals("[No LLM configured]", chunk.getText()))
                .assertNext(chunk -> assertTrue(chunk.isDone()))
                .verifyComplete();
    }

    @Test
    void shouldDescribeItselfAsUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
        assertFalse(adapter.isAvailable());
        assertFalse(adapter.supportsStreaming());
        assertTrue(adapter.getSupportedModels().isEmpty());
    }
}
