package com.deskmind.core.nodes;

import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.LlmTimeoutException;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Role;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConverseNodeTest {

    private CompletionService mockLlm;
    private ConverseNode node;

    @BeforeEach
    void setUp() {
        mockLlm = mock(CompletionService.class);
        node = new ConverseNode(mockLlm);
    }

    @SuppressWarnings("unchecked")
    private static Turn lastTurn(Map<String, Object> result) {
        List<Turn> transcript = (List<Turn>) result.get("transcript");
        return transcript.get(transcript.size() - 1);
    }

    @Test
    @DisplayName("replies in words and completes the task")
    void replies() {
        when(mockLlm.complete(anyString(), anyList())).thenReturn("Hello! What can I do for you?\n\nI can open apps.");

        Map<String, Object> result = node.apply(new ExecutionState(Map.of(
                "transcript", List.of(Turn.user("Hi")))));

        Turn turn = lastTurn(result);
        assertEquals(Role.ASSISTANT, turn.role());
        assertEquals("Hello! What can I do for you?", turn.content());
        assertFalse(turn.hasToolCalls());
        assertEquals(TaskStatus.COMPLETED.name(), result.get("status"));
        assertEquals("Hello! What can I do for you?", result.get("finalMessage"));
    }

    @Test
    @DisplayName("greets without calling the model on empty input")
    void emptyInputGreets() {
        Map<String, Object> result = node.apply(new ExecutionState(Map.of(
                "transcript", List.of(Turn.user("")))));

        assertEquals(ConverseNode.GREETING, lastTurn(result).content());
        verifyNoInteractions(mockLlm);
    }

    @Test
    @DisplayName("a planned chat subtask is passed to the model")
    void plannedSubtask() {
        when(mockLlm.complete(anyString(), anyList())).thenReturn("2^64 is 18446744073709551616.");

        node.apply(new ExecutionState(Map.of(
                "transcript", List.of(Turn.user("What is 2^64?")),
                "currentSubtask", new Subtask("Explain the result", ExecutorKind.CONVERSATIONAL, 1))));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Turn>> window = ArgumentCaptor.forClass(List.class);
        verify(mockLlm).complete(anyString(), window.capture());
        assertEquals("Respond to this: Explain the result",
                window.getValue().get(window.getValue().size() - 1).content());
    }

    @Test
    @DisplayName("a failed call ends the task as COLLABORATOR_UNAVAILABLE with an apology")
    void unavailable() {
        when(mockLlm.complete(anyString(), anyList())).thenThrow(new LlmTimeoutException(Duration.ofSeconds(5)));

        Map<String, Object> result = node.apply(new ExecutionState(Map.of(
                "transcript", List.of(Turn.user("Tell me a joke")))));

        assertEquals(ConverseNode.UNAVAILABLE, lastTurn(result).content());
        assertEquals(TaskStatus.FAILED.name(), result.get("status"));
        assertEquals(FailureCode.COLLABORATOR_UNAVAILABLE.name(), result.get("failureCode"));
    }
}
