package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStateTest {

    private static final String SYSTEM_PROMPT = "You are helpful.";

    @Test
    void shouldPlaceSystemPromptFirst() {
        ConversationState state = new ConversationState(SYSTEM_PROMPT);

        assertEquals(1, state.size());
        assertTrue(state.asTranscript().get(0).isSystemMessage());
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        assertEquals(0, new ConversationState("  ").size());
    }

    @Test
    void shouldRejectSecondSystemMessage() {
        ConversationState state = new ConversationState(SYSTEM_PROMPT);

        assertThrows(ConversationStateException.class, () -> state.append(Message.system("again")));
    }

    @Test
    void shouldRejectSystemMessageAfterDialogue() {
        ConversationState state = new ConversationState();
        state.append(Message.user("hi"));

        assertThrows(ConversationStateException.class, () -> state.append(Message.system(SYSTEM_PROMPT)));
    }

    @Test
    void shouldAcceptToolMessageAnsweringLastAssistantCall() {
        ConversationState state = new ConversationState();
        state.append(Message.user("add"));
        state.append(Message.assistantToolCalls(null, List.of(call("c1"), call("c2"))));

        state.append(Message.toolResult("c2", "calculator", "4"));
        state.append(Message.toolResult("c1", "calculator", "5"));

        assertEquals(4, state.size());
    }

    @Test
    void shouldRejectToolMessageWithoutPrecedingCall() {
        ConversationState state = new ConversationState();
        state.append(Message.user("add"));

        assertThrows(ConversationStateException.class,
                () -> state.append(Message.toolResult("c1", "calculator", "4")));
    }

    @Test
    void shouldRejectToolMessageForUnknownCallId() {
        ConversationState state = new ConversationState();
        state.append(Message.assistantToolCalls(null, List.of(call("c1"))));

        assertThrows(ConversationStateException.class,
                () -> state.append(Message.toolResult("other", "calculator", "4")));
    }

    @Test
    void shouldRollBackToSnapshotLength() {
        ConversationState state = new ConversationState(SYSTEM_PROMPT);
        int snapshot = state.snapshot();
        state.append(Message.user("hello"));
        state.append(Message.assistantToolCalls(null, List.of(call("c1"))));
        state.append(Message.toolResult("c1", "echo", "hello"));

        state.rollback(snapshot);

        assertEquals(snapshot, state.size());
        assertTrue(state.asTranscript().get(0).isSystemMessage());
    }

    @Test
    void shouldRejectSnapshotOutsideLog() {
        ConversationState state = new ConversationState();
        state.append(Message.user("hello"));

        assertThrows(IllegalArgumentException.class, () -> state.rollback(5));
        assertThrows(IllegalArgumentException.class, () -> state.rollback(-1));
    }

    @Test
    void shouldReturnDetachedTranscript() {
        ConversationState state = new ConversationState();
        state.append(Message.user("hello"));

        List<Message> transcript = state.asTranscript();
        state.append(Message.assistant("hi"));

        assertEquals(1, transcript.size());
        assertThrows(UnsupportedOperationException.class, () -> transcript.add(Message.user("x")));
    }

    @Test
    void shouldResetKeepingSystemMessage() {
        ConversationState state = new ConversationState(SYSTEM_PROMPT);
        state.append(Message.user("hello"));
        state.append(Message.assistant("hi"));

        state.reset();

        assertEquals(1, state.size());
        assertNull(state.lastAssistantMessage());
    }

    @Test
    void shouldFindLastAssistantMessage() {
        ConversationState state = new ConversationState();
        state.append(Message.user("q1"));
        Message first = Message.assistant("a1");
        state.append(first);
        state.append(Message.user("q2"));

        assertSame(first, state.lastAssistantMessage());
    }

    private static Message.ToolCall call(String id) {
        return Message.ToolCall.builder().id(id).name("calculator").arguments(Map.of()).build();
    }
}
