package com.deskmind.dispatch.cli;

import com.deskmind.core.engine.TaskEngine;
import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.TaskResult;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.ToolDescriptor;
import com.deskmind.core.model.Turn;
import com.deskmind.core.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Deskmind CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private TaskEngine engine;
    private ToolRegistry toolRegistry;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        engine = mock(TaskEngine.class);
        toolRegistry = mock(ToolRegistry.class);
        eventBus = new EventBus();
    }

    private static TaskResult result(TaskStatus status, FailureCode code, String message, int gate) {
        return new TaskResult("DESK-2026-0001", status, code, message, List.of(Turn.user("x")), gate);
    }

    /**
     * Custom picocli IFactory that wires commands to the mocked engine and registry
     * and to a console fed from {@code stdin}.
     */
    private CommandLine.IFactory createFactory(String stdin) {
        var input = new ConsoleInput(new BufferedReader(new StringReader(stdin)));
        var conversation = new TaskConversation(engine, eventBus, input);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AskCommand.class) {
                    return (K) new AskCommand(conversation);
                }
                if (cls == ShellCommand.class) {
                    return (K) new ShellCommand(conversation, input);
                }
                if (cls == ToolsCommand.class) {
                    return (K) new ToolsCommand(toolRegistry);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return executeWithInput("", args);
    }

    private CliResult executeWithInput(String stdin, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new DeskmindCommand(), createFactory(stdin));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ask"));
            assertTrue(result.output().contains("shell"));
            assertTrue(result.output().contains("tools"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Deskmind 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("DESKMIND"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("ask without a request is a usage error")
        void askWithoutRequest() {
            CliResult result = execute("ask");
            assertEquals(2, result.exitCode());
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("ask")
    class AskTests {

        @Test
        @DisplayName("joins the words of the request and exits 0 on completion")
        void completes() {
            when(engine.run("Open calculator"))
                    .thenReturn(result(TaskStatus.COMPLETED, FailureCode.NONE, "Opened calculator", 0));

            CliResult result = execute("ask", "Open", "calculator");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Opened calculator"));
        }

        @Test
        @DisplayName("--verbose prints engine events only while the task runs")
        void verbosePrintsEvents() {
            when(engine.run("Open calculator")).thenAnswer(inv -> {
                eventBus.publish(DeskmindEvent.of("tool.invoked", "DESK-2026-0001", 0,
                        Map.of("tool", "open_app", "outcome", "ok", "output", "Calculator opened")));
                return result(TaskStatus.COMPLETED, FailureCode.NONE, "Opened calculator", 0);
            });

            CliResult verbose = execute("ask", "--verbose", "Open", "calculator");
            CliResult quiet = execute("ask", "Open", "calculator");

            assertEquals(0, verbose.exitCode());
            assertTrue(verbose.output().contains("open_app ok: Calculator opened"));
            assertFalse(quiet.output().contains("open_app ok"));
        }

        @Test
        @DisplayName("exits 1 and shows the failure code when the task fails")
        void fails() {
            when(engine.run(anyString())).thenReturn(result(TaskStatus.FAILED, FailureCode.RETRY_BUDGET_EXHAUSTED,
                    FailureCode.RETRY_BUDGET_EXHAUSTED.message(), 0));

            CliResult result = execute("ask", "Resize the window");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("RETRY_BUDGET_EXHAUSTED"));
        }

        @Test
        @DisplayName("asks on the console at a gate and resumes with the answer")
        void resumesAfterGate() {
            when(engine.run(anyString()))
                    .thenReturn(result(TaskStatus.AWAITING_HUMAN, FailureCode.NONE, "Did this work?", 1));
            when(engine.resume("DESK-2026-0001", 1, HumanDecision.NO, "the scientific one"))
                    .thenReturn(result(TaskStatus.COMPLETED, FailureCode.NONE, "Opened scientific calculator", 1));

            CliResult result = executeWithInput("no, the scientific one\n", "ask", "Open calculator");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Did this work?"));
            assertTrue(result.output().contains("Opened scientific calculator"));
        }

        @Test
        @DisplayName("end of input at a gate aborts the task")
        void endOfInputAborts() {
            when(engine.run(anyString()))
                    .thenReturn(result(TaskStatus.AWAITING_HUMAN, FailureCode.NONE, "Did this work?", 1));
            when(engine.resume("DESK-2026-0001", 1, HumanDecision.ABORT, ""))
                    .thenReturn(result(TaskStatus.FAILED, FailureCode.USER_ABORT, "Stopped at your request.", 1));

            CliResult result = execute("ask", "Open calculator");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("USER_ABORT"));
        }

        @Test
        @DisplayName("an engine exception is reported with its root cause")
        void engineException() {
            when(engine.run(anyString())).thenThrow(new IllegalStateException("wrapper",
                    new IllegalArgumentException("bad request")));

            CliResult result = execute("ask", "Open calculator");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Task failed: bad request"));
        }
    }

    @Nested
    @DisplayName("shell")
    class ShellTests {

        @Test
        @DisplayName("runs each non-blank line until quit")
        void runsLinesUntilQuit() {
            when(engine.run(anyString()))
                    .thenReturn(result(TaskStatus.COMPLETED, FailureCode.NONE, "Hello!", 0));

            CliResult result = executeWithInput("hi\n\n  \nwhat time is it\nquit\nnever read\n", "shell");

            assertEquals(0, result.exitCode());
            verify(engine).run("hi");
            verify(engine).run("what time is it");
            verify(engine, never()).run("never read");
            assertTrue(result.output().contains("Bye."));
        }

        @Test
        @DisplayName("keeps going after a failing request and stops at end of input")
        void survivesFailures() {
            when(engine.run("boom")).thenThrow(new IllegalStateException("engine down"));
            when(engine.run("hi")).thenReturn(result(TaskStatus.COMPLETED, FailureCode.NONE, "Hello!", 0));

            CliResult result = executeWithInput("boom\nhi\n", "shell");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Task failed: engine down"));
            assertTrue(result.output().contains("Hello!"));
        }
    }

    @Nested
    @DisplayName("tools")
    class ToolsTests {

        @Test
        @DisplayName("lists registered tools")
        void listsTools() {
            when(toolRegistry.listTools()).thenReturn(List.of(
                    new ToolDescriptor("get_time", "Get the current local date and time"),
                    new ToolDescriptor("run_python", "Run Python 3 source code")));

            CliResult result = execute("tools");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 tool(s) available"));
            assertTrue(result.output().contains("get_time"));
            assertTrue(result.output().contains("run_python"));
        }

        @Test
        @DisplayName("says so when no tools are registered")
        void noTools() {
            when(toolRegistry.listTools()).thenReturn(List.of());

            assertTrue(execute("tools").output().contains("No tools registered."));
        }
    }
}
