package com.deskmind.dispatch.cli;

import com.deskmind.core.model.TaskResult;
import com.deskmind.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: deskmind ask "&lt;request&gt;"
 * <p>
 * Runs a single request through the orchestration engine and prints the outcome.
 * Exits with 0 when the task completed and 1 otherwise.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Run a single request")
@Component
public class AskCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "1..*", description = "Natural language request")
    private String[] request;

    @Option(names = {"--verbose", "-v"}, description = "Print engine events while the task runs")
    private boolean verbose;

    private final TaskConversation conversation;

    public AskCommand(TaskConversation conversation) {
        this.conversation = conversation;
    }

    @Override
    public Integer call() {
        TaskResult result;
        try {
            result = conversation.handle(String.join(" ", request), verbose);
        } catch (Exception e) {
            ConsoleOutput.error("Task failed: " + rootCauseMessage(e));
            return 1;
        }
        ConsoleOutput.outcome(result);
        return result.status() == TaskStatus.COMPLETED ? 0 : 1;
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
