package me.golemcore.incident.domain.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.incident.domain.conversation.NormalizationDiagnostic.Kind;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConverseHistoryNormalizerTest {

    private ConverseHistoryNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ConverseHistoryNormalizer(new ObjectMapper());
    }

    // ===== basic shapes =====

    @Test
    void shouldReturnEmptyViewForNullOrEmptyHistory() {
        assertTrue(normalizer.normalize(null).messages().isEmpty());
        assertTrue(normalizer.normalize(List.of()).messages().isEmpty());
    }

    @Test
    void shouldPassPlainConversationThrough() {
        List<Message> history = List.of(
                Message.user("pods are crashing in payments"),
                Message.assistant("Which namespace?"),
                Message.user("prod"));

        ConversationView view = normalizer.normalize(history);

        assertEquals(history, view.messages());
        assertTrue(view.diagnostics().isEmpty());
    }

    @Test
    void shouldDropOrphanedResultAndKeepPairedOne() {
        List<Message> history = List.of(
                Message.of(Role.ASSISTANT, ContentBlock.toolCall("t1", "f", Map.of())),
                Message.of(Role.TOOL, ContentBlock.toolResult("t1", "ok"), ContentBlock.toolResult("t9", "lost")));

        ConversationView view = normalizer.normalize(history);

        assertEquals(2, view.messages().size());
        Message assistant = view.messages().get(0);
        assertEquals(Role.ASSISTANT, assistant.getRole());
        assertEquals("t1", assistant.getToolCalls().get(0).callId());

        Message user = view.messages().get(1);
        assertEquals(Role.USER, user.getRole());
        assertEquals(1, user.getContents().size());
        assertEquals("t1", user.getToolResults().get(0).callId());

        assertTrue(view.diagnostics().stream()
                .anyMatch(d -> d.kind() == Kind.ORPHANED_TOOL_RESULT && "t9".equals(d.callId())));
    }

    @Test
    void shouldFlattenMixedToolMessageToText() {
        List<Message> history = List.of(
                Message.of(Role.TOOL, ContentBlock.toolCall("t2", "g", Map.of("q", "x")),
                        ContentBlock.toolResult("t2", "done")));

        ConversationView view = normalizer.normalize(history);

        assertEquals(1, view.messages().size());
        Message user = view.messages().get(0);
        assertEquals(Role.USER, user.getRole());
        assertTrue(user.getContents().stream().allMatch(ContentBlock.Text.class::isInstance));
        String first = ((ContentBlock.Text) user.getContents().get(0)).text();
        assertTrue(first.startsWith("[Tool Call: g (id: t2)]"));
        assertTrue(first.contains("\nInput: "));
        assertTrue(first.contains("\"q\" : \"x\""));
        String second = ((ContentBlock.Text) user.getContents().get(1)).text();
        assertEquals("[Tool Result for: t2]\nOutput: done", second);
        assertTrue(view.diagnostics().stream().anyMatch(d -> d.kind() == Kind.MIXED_CONTENT_SPLIT));
    }

    @Test
    void shouldPlaceUnmatchedResultsThenOwnTextAheadOfToolTrace() {
        List<Message> history = List.of(
                Message.of(Role.ASSISTANT, ContentBlock.toolCall("t1", "delegate", Map.of())),
                Message.of(Role.TOOL,
                        ContentBlock.text("sub-agent transcript"),
                        ContentBlock.toolCall("s1", "kubectl", "{\"ns\":\"prod\"}"),
                        ContentBlock.toolResult("s1", "3 pods"),
                        ContentBlock.toolResult("t1", "summary")));

        ConversationView view = normalizer.normalize(history);

        Message user = view.messages().get(1);
        List<ContentBlock> contents = user.getContents();
        assertEquals(4, contents.size());
        assertEquals(new ContentBlock.ToolResult("t1", "summary", null), contents.get(0));
        assertEquals("sub-agent transcript", ((ContentBlock.Text) contents.get(1)).text());
        assertTrue(((ContentBlock.Text) contents.get(2)).text().startsWith("[Tool Call: kubectl (id: s1)]"));
        assertTrue(((ContentBlock.Text) contents.get(3)).text().startsWith("[Tool Result for: s1]"));
    }

    @Test
    void shouldKeepSummaryAheadOfRenderedToolTrace() {
        List<Message> history = List.of(
                Message.of(Role.TOOL,
                        ContentBlock.text("sub-agent summary"),
                        ContentBlock.toolCall("t2", "g", null),
                        ContentBlock.toolResult("t2", "done")));

        List<ContentBlock> contents = normalizer.normalize(history).messages().get(0).getContents();

        assertEquals(3, contents.size());
        assertEquals("sub-agent summary", ((ContentBlock.Text) contents.get(0)).text());
        assertEquals("[Tool Call: g (id: t2)]", ((ContentBlock.Text) contents.get(1)).text());
        assertEquals("[Tool Result for: t2]\nOutput: done", ((ContentBlock.Text) contents.get(2)).text());
    }

    @Test
    void shouldRenderErrorOfPairedResult() {
        List<Message> history = List.of(
                Message.of(Role.TOOL, ContentBlock.toolCall("t3", "logs", null),
                        ContentBlock.toolError("t3", "timeout")));

        ConversationView view = normalizer.normalize(history);

        List<ContentBlock> contents = view.messages().get(0).getContents();
        assertEquals("[Tool Call: logs (id: t3)]", ((ContentBlock.Text) contents.get(0)).text());
        assertEquals("[Tool Result for: t3]\nError: timeout", ((ContentBlock.Text) contents.get(1)).text());
    }

    @Test
    void shouldRenderUnparseableStringArgumentsVerbatim() {
        String rendered = normalizer.renderToolCall(new ContentBlock.ToolCall("t4", "sh", "not json"));

        assertEquals("[Tool Call: sh (id: t4)]\nInput: not json", rendered);
    }

    // ===== role filtering =====

    @Test
    void shouldDropToolResultFromAssistantAndItsLaterResult() {
        List<Message> history = List.of(
                Message.of(Role.ASSISTANT, ContentBlock.text("checking"),
                        ContentBlock.toolCall("t1", "f", Map.of()),
                        ContentBlock.toolResult("t1", "premature")),
                Message.of(Role.USER, ContentBlock.toolResult("t1", "real"), ContentBlock.text("and?")));

        ConversationView view = normalizer.normalize(history);

        Message assistant = view.messages().get(0);
        assertFalse(assistant.hasToolResults());
        assertEquals(2, assistant.getContents().size());

        Message user = view.messages().get(1);
        assertFalse(user.hasToolResults());
        assertEquals("and?", user.getText());
    }

    @Test
    void shouldDropToolCallsFromUserTurns() {
        List<Message> history = List.of(
                Message.of(Role.USER, ContentBlock.text("hi"), ContentBlock.toolCall("u1", "f", Map.of())),
                Message.of(Role.TOOL, ContentBlock.toolCall("u2", "g", Map.of())));

        ConversationView view = normalizer.normalize(history);

        assertEquals(1, view.messages().size());
        assertEquals(List.of(ContentBlock.text("hi")), view.messages().get(0).getContents());
        assertEquals(2, view.diagnostics().stream().filter(d -> d.kind() == Kind.TOOL_CALL_DROPPED).count());
        assertTrue(view.diagnostics().stream().anyMatch(d -> d.kind() == Kind.EMPTY_MESSAGE_DROPPED
                && d.messageIndex() == 1));
    }

    @Test
    void shouldDropResultWhoseCallComesLater() {
        List<Message> history = List.of(
                Message.of(Role.TOOL, ContentBlock.toolResult("t1", "early")),
                Message.of(Role.ASSISTANT, ContentBlock.toolCall("t1", "f", Map.of())));

        ConversationView view = normalizer.normalize(history);

        assertEquals(1, view.messages().size());
        assertEquals(Role.ASSISTANT, view.messages().get(0).getRole());
    }

    @Test
    void shouldDropResultWithoutCallId() {
        List<Message> history = List.of(
                Message.of(Role.ASSISTANT, ContentBlock.toolCall("t1", "f", Map.of())),
                Message.of(Role.TOOL, ContentBlock.toolResult(null, "anonymous"),
                        ContentBlock.toolResult("t1", "ok")));

        ConversationView view = normalizer.normalize(history);

        assertEquals(1, view.messages().get(1).getContents().size());
    }

    // ===== system =====

    @Test
    void shouldLiftSystemMessagesOutOfConversation() {
        List<Message> history = List.of(
                Message.system("You are an SRE assistant."),
                Message.user("hello"),
                Message.of(Role.SYSTEM, ContentBlock.text("Be "), ContentBlock.text("brief."),
                        ContentBlock.toolCall("x", "f", Map.of())),
                Message.of(Role.SYSTEM, ContentBlock.toolResult("y", "z")));

        ConversationView view = normalizer.normalize(history);

        assertEquals(List.of("You are an SRE assistant.", "Be brief."), view.systemInstructions());
        assertEquals(1, view.messages().size());
        assertTrue(view.messages().stream().noneMatch(Message::isSystemMessage));
    }

    // ===== ownership =====

    @Test
    void shouldNotMutateInputHistory() {
        List<Message> history = new ArrayList<>(List.of(
                Message.of(Role.ASSISTANT, ContentBlock.toolCall("t1", "f", Map.of())),
                Message.of(Role.TOOL, ContentBlock.toolResult("t1", "ok"), ContentBlock.toolResult("t9", "x"))));
        List<Message> snapshot = List.copyOf(history);

        normalizer.normalize(history);

        assertEquals(snapshot, history);
        assertEquals(2, history.get(1).getContents().size());
    }

    @Test
    void shouldSkipNullMessages() {
        List<Message> history = new ArrayList<>();
        history.add(null);
        history.add(Message.user("still here"));

        ConversationView view = normalizer.normalize(history);

        assertEquals(1, view.messages().size());
    }

    // ===== properties over generated histories =====

    @Test
    void shouldSatisfyStructuralPropertiesForRandomHistories() {
        Random random = new Random(42);
        for (int run = 0; run < 500; run++) {
            List<Message> history = randomHistory(random);

            ConversationView view = normalizer.normalize(history);
            List<Message> output = view.messages();

            assertNoOrphans(output);
            assertRolePurity(output);
            assertTrue(output.stream().noneMatch(Message::isSystemMessage));
            assertTrue(output.stream().noneMatch(Message::isToolMessage));
            assertTrue(output.stream().noneMatch(Message::isEmpty));

            ConversationView again = normalizer.normalize(output);
            assertEquals(output, again.messages(), "normalize must be idempotent for run " + run);
        }
    }

    private void assertNoOrphans(List<Message> output) {
        Set<String> available = new HashSet<>();
        for (Message message : output) {
            if (message.isAssistantMessage()) {
                message.getToolCalls().forEach(call -> available.add(call.callId()));
            }
            for (ContentBlock.ToolResult result : message.getToolResults()) {
                assertNotNull(result.callId());
                assertTrue(available.contains(result.callId()), "orphan " + result.callId());
            }
        }
    }

    private void assertRolePurity(List<Message> output) {
        for (Message message : output) {
            if (message.isAssistantMessage()) {
                assertFalse(message.hasToolResults());
            }
            if (message.isUserMessage()) {
                assertFalse(message.hasToolCalls());
            }
        }
    }

    private List<Message> randomHistory(Random random) {
        Role[] roles = Role.values();
        List<Message> history = new ArrayList<>();
        int size = random.nextInt(8);
        for (int i = 0; i < size; i++) {
            List<ContentBlock> contents = new ArrayList<>();
            int blocks = random.nextInt(4);
            for (int b = 0; b < blocks; b++) {
                String id = random.nextInt(5) == 0 ? null : "t" + random.nextInt(4);
                switch (random.nextInt(3)) {
                case 0 -> contents.add(ContentBlock.text("text " + random.nextInt(100)));
                case 1 -> contents.add(ContentBlock.toolCall(id, "tool" + random.nextInt(3), Map.of("n", b)));
                default -> contents.add(random.nextBoolean()
                        ? ContentBlock.toolResult(id, "out")
                        : ContentBlock.toolError(id, "boom"));
                }
            }
            history.add(Message.of(roles[random.nextInt(roles.length)], contents));
        }
        return history;
    }
}
