package me.golemcore.incident.adapter.outbound.llm.converse;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConverseResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConverseResponseParser parser = new ConverseResponseParser(objectMapper);

    @Test
    void shouldParseTextAndToolUse() throws Exception {
        ConverseResponse response = objectMapper.readValue("""
                {
                  "output": {"message": {"role": "assistant", "content": [
                    {"text": "Looking at logs."},
                    {"toolUse": {"toolUseId": "tu-1", "name": "get_pod_logs", "input": {"pod": "api-7", "tail": 50}}}
                  ]}},
                  "stopReason": "tool_use",
                  "usage": {"inputTokens": 100, "outputTokens": 20, "totalTokens": 120},
                  "metrics": {"latencyMs": 900}
                }
                """, ConverseResponse.class);

        LlmResponse parsed = parser.parse(response, "model-x");

        assertEquals("Looking at logs.", parsed.getContent());
        assertEquals(FinishReason.TOOL_CALLS, parsed.getFinishReason());
        assertEquals(1, parsed.getToolCalls().size());
        assertEquals("tu-1", parsed.getToolCalls().get(0).callId());
        assertEquals(Map.of("pod", "api-7", "tail", 50), parsed.getToolCalls().get(0).arguments());
        assertEquals(2, parsed.getMessage().getContents().size());
        assertEquals(120, parsed.getUsage().getTotalTokens());
        assertEquals("model-x", parsed.getModel());
    }

    @Test
    void shouldTolerateMissingOutputAndUsage() {
        LlmResponse parsed = parser.parse(new ConverseResponse(), "m");

        assertEquals("", parsed.getContent());
        assertTrue(parsed.getMessage().isEmpty());
        assertNull(parsed.getUsage());
        assertEquals(FinishReason.STOP, parsed.getFinishReason());
    }
}
