package com.deskmind.dispatch.cli;

import com.deskmind.core.engine.TaskEngine;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.model.TaskResult;
import org.springframework.stereotype.Component;

/**
 * Runs one request to its end on the terminal: streams progress events while the
 * engine works and, when a task stops at a human gate, reads the answer from the
 * console and resumes it until the task completes or fails.
 */
@Component
public class TaskConversation {

    private final TaskEngine taskEngine;
    private final EventBus eventBus;
    private final ConsoleInput input;

    public TaskConversation(TaskEngine taskEngine, EventBus eventBus, ConsoleInput input) {
        this.taskEngine = taskEngine;
        this.eventBus = eventBus;
        this.input = input;
    }

    public TaskResult handle(String request, boolean verbose) {
        try (EventBus.Subscription progress = verbose
                ? eventBus.subscribe(ConsoleOutput::event)
                : EventBus.Subscription.NONE) {
            TaskResult result = taskEngine.run(request);
            while (result.awaitingHuman()) {
                var reply = ConsoleHumanChannel.parse(askConsole(result.finalMessage()));
                result = taskEngine.resume(result.taskId(), result.gateNumber(),
                        reply.decision(), reply.context());
            }
            return result;
        }
    }

    private String askConsole(String question) {
        ConsoleOutput.question(question);
        return input.readLine();
    }
}
