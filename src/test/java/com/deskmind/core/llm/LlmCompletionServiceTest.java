package com.deskmind.core.llm;

import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.UserMessage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmCompletionService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmCompletionServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmCompletionService service;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.messages(anyList())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        service = new LlmCompletionService(mockChatClient, Runnable::run, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("complete sends the system prompt and window and returns the content")
    @SuppressWarnings("unchecked")
    void completeSendsPromptAndWindow() {
        when(mockCallResponse.content()).thenReturn("SUCCESS it worked");

        String reply = service.complete("You are a verifier", List.of(Turn.user("what time is it")));

        assertEquals("SUCCESS it worked", reply);
        verify(mockRequestSpec).system("You are a verifier");
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(mockRequestSpec).messages(captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals(MessageType.USER, captor.getValue().get(0).getMessageType());
    }

    @Test
    @DisplayName("blank system prompt is not sent")
    void blankSystemPromptSkipped() {
        when(mockCallResponse.content()).thenReturn("hello");

        service.complete("", List.of(Turn.user("hi")));

        verify(mockRequestSpec, never()).system(anyString());
    }

    @Test
    @DisplayName("blank reply raises LlmEmptyResponseException")
    void blankReplyThrows() {
        when(mockCallResponse.content()).thenReturn("   ");

        assertThrows(LlmEmptyResponseException.class,
                () -> service.complete("system", List.of(Turn.user("hi"))));
    }

    @Test
    @DisplayName("runtime failures from the client propagate unwrapped")
    void clientFailurePropagates() {
        when(mockRequestSpec.call()).thenThrow(new IllegalStateException("connection refused"));

        var ex = assertThrows(IllegalStateException.class,
                () -> service.complete("system", List.of(Turn.user("hi"))));
        assertEquals("connection refused", ex.getMessage());
    }

    @Test
    @DisplayName("a call slower than the timeout raises LlmTimeoutException")
    void slowCallTimesOut() {
        when(mockCallResponse.content()).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return "too late";
        });
        var pool = Executors.newSingleThreadExecutor();
        try {
            var slowService = new LlmCompletionService(mockChatClient, pool, Duration.ofMillis(100));
            assertThrows(LlmTimeoutException.class,
                    () -> slowService.complete("system", List.of(Turn.user("hi"))));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("a timed-out call is interrupted so the next call gets the worker")
    void timeoutFreesWorker() throws Exception {
        var interrupted = new CountDownLatch(1);
        when(mockCallResponse.content())
                .thenAnswer(inv -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return "too late";
                })
                .thenReturn("SUCCESS on time");
        var pool = Executors.newSingleThreadExecutor();
        try {
            var slowService = new LlmCompletionService(mockChatClient, pool, Duration.ofMillis(300));
            assertThrows(LlmTimeoutException.class,
                    () -> slowService.complete("system", List.of(Turn.user("hi"))));
            assertTrue(interrupted.await(2, TimeUnit.SECONDS), "stalled call was not interrupted");

            assertEquals("SUCCESS on time", slowService.complete("system", List.of(Turn.user("hi again"))));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("toMessages renders tool calls and tool output as text")
    void toMessagesRendersToolTurns() {
        var call = new ToolCall("call_0", "get_time", Map.of());
        var messages = LlmCompletionService.toMessages(List.of(
                Turn.user("what time is it"),
                Turn.assistant("", List.of(call)),
                Turn.tool(call, "The current time is noon")));

        assertEquals(3, messages.size());
        assertInstanceOf(AssistantMessage.class, messages.get(1));
        assertEquals("get_time {}", messages.get(1).getText());
        assertInstanceOf(UserMessage.class, messages.get(2));
        assertEquals("Tool get_time returned:\nThe current time is noon", messages.get(2).getText());
    }
}
