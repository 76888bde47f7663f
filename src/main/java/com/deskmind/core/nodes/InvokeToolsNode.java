package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.Role;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.ToolResult;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import com.deskmind.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tool invocation stage: runs the pending calls of the latest ASSISTANT turn.
 * <p>
 * Calls whose names are not yet in {@code completedToolNames} are dispatched to the
 * registry on the bounded {@code toolExecutor} pool and all are joined before the node
 * returns. Each call gets {@code tool-timeout} from the moment it starts running; a call
 * that overruns is cancelled with an interrupt so its worker goes back to the pool.
 * One TOOL turn per call is appended in the order the calls were emitted. The stage
 * never judges success: failures and timeouts become ordinary TOOL turns. Unknown
 * tools, and the code tool requested by the tool-selecting executor, are recorded as
 * unavailable.
 */
@Component
public class InvokeToolsNode {

    private static final Logger log = LoggerFactory.getLogger(InvokeToolsNode.class);

    enum Outcome { OK, ERROR, TIMEOUT, UNAVAILABLE }

    record Invocation(ToolCall call, Outcome outcome, String output, long elapsedMs) {}

    /**
     * A call answered on the spot ({@code answered} set) or running on the tool pool.
     * {@code startedAt} stays 0 while the task waits in the pool's queue.
     */
    private record Dispatch(ToolCall call, Invocation answered, FutureTask<ToolResult> task, AtomicLong startedAt) {

        static Dispatch answered(Invocation invocation) {
            return new Dispatch(invocation.call(), invocation, null, new AtomicLong());
        }

        long elapsedMs() {
            long started = startedAt.get();
            return started == 0 ? 0 : System.currentTimeMillis() - started;
        }
    }

    private final ToolRegistry toolRegistry;
    private final Executor toolExecutor;
    private final EventBus eventBus;
    private final DeskmindMetrics metrics;
    private final Duration toolTimeout;
    private final String codeToolName;

    public InvokeToolsNode(ToolRegistry toolRegistry,
                           @Qualifier("toolExecutor") Executor toolExecutor,
                           EventBus eventBus,
                           DeskmindMetrics metrics,
                           EngineProperties properties) {
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.toolTimeout = properties.getToolTimeout();
        this.codeToolName = properties.getCodeToolName();
    }

    public Map<String, Object> apply(ExecutionState state) {
        List<Turn> attemptTurns = state.turnsOfLastAttempt();
        if (attemptTurns.isEmpty() || attemptTurns.get(0).role() != Role.ASSISTANT) {
            return Map.of("status", TaskStatus.VERIFYING.name());
        }

        Set<String> completed = state.completedToolNames();
        List<ToolCall> pending = attemptTurns.get(0).toolCalls().stream()
                .filter(call -> !completed.contains(call.name()))
                .toList();
        ExecutorKind kind = state.currentExecutorKind().orElse(ExecutorKind.TOOL_SELECTING);

        var dispatches = new ArrayList<Dispatch>(pending.size());
        for (ToolCall call : pending) {
            dispatches.add(dispatch(call, kind));
        }

        var toolTurns = new ArrayList<Turn>(pending.size());
        var names = new TreeSet<>(completed);
        var unavailable = new TreeSet<>(state.unavailableTools());
        for (Dispatch dispatch : dispatches) {
            Invocation invocation = await(dispatch);
            ToolCall call = invocation.call();
            toolTurns.add(Turn.tool(call, invocation.output()));
            names.add(call.name());
            if (invocation.outcome() == Outcome.UNAVAILABLE) {
                unavailable.add(call.name());
            }
            if (!call.isNoOp()) {
                record(state, invocation);
            }
        }

        return Map.of(
                "transcript", state.appendTurns(toolTurns),
                "completedToolNames", List.copyOf(names),
                "unavailableTools", List.copyOf(unavailable),
                "status", TaskStatus.VERIFYING.name()
        );
    }

    private Dispatch dispatch(ToolCall call, ExecutorKind kind) {
        if (call.isNoOp()) {
            Object reason = call.args().get("reason");
            String output = reason == null || reason.toString().isBlank()
                    ? "No action taken."
                    : "No action taken: " + reason;
            return Dispatch.answered(new Invocation(call, Outcome.OK, output, 0));
        }
        if (kind == ExecutorKind.TOOL_SELECTING && codeToolName.equals(call.name())) {
            return Dispatch.answered(new Invocation(call, Outcome.UNAVAILABLE,
                    "Tool '" + call.name() + "' is not available to the tool-selecting executor", 0));
        }

        var startedAt = new AtomicLong();
        var task = new FutureTask<ToolResult>(() -> {
            startedAt.set(System.currentTimeMillis());
            return toolRegistry.invoke(call.name(), call.args());
        });
        try {
            toolExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Tool pool rejected {}: {}", call.name(), e.getMessage());
            return Dispatch.answered(new Invocation(call, Outcome.ERROR,
                    "Error: tool " + call.name() + " could not be scheduled", 0));
        }
        return new Dispatch(call, null, task, startedAt);
    }

    /**
     * Waits for one call. Calls are awaited in emission order, so by the time a call is
     * awaited every earlier one has finished or been cancelled and this one holds a worker
     * or is next in line for one.
     */
    private Invocation await(Dispatch dispatch) {
        if (dispatch.answered() != null) {
            return dispatch.answered();
        }
        ToolCall call = dispatch.call();
        long budget = toolTimeout.toMillis();
        long started = dispatch.startedAt().get();
        long remaining = started == 0 ? budget : budget - (System.currentTimeMillis() - started);
        try {
            ToolResult result = dispatch.task().get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
            if (!result.found()) {
                return new Invocation(call, Outcome.UNAVAILABLE, result.output(), dispatch.elapsedMs());
            }
            return new Invocation(call, Outcome.OK, result.output(), dispatch.elapsedMs());
        } catch (TimeoutException e) {
            dispatch.task().cancel(true);
            log.warn("Tool {} timed out after {}ms, cancelled", call.name(), budget);
            return new Invocation(call, Outcome.TIMEOUT,
                    "Error: " + call.name() + " timed out after " + toolTimeout.toSeconds() + "s", dispatch.elapsedMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Tool {} failed: {}", call.name(), cause.getMessage());
            return new Invocation(call, Outcome.ERROR, "Error: " + ExecutorNode.describe(cause), dispatch.elapsedMs());
        } catch (InterruptedException e) {
            dispatch.task().cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for tool {}", call.name());
            return new Invocation(call, Outcome.ERROR, "Error: " + call.name() + " was interrupted", dispatch.elapsedMs());
        }
    }

    private void record(ExecutionState state, Invocation invocation) {
        String outcome = invocation.outcome().name().toLowerCase(Locale.ROOT);
        metrics.recordToolInvocation(invocation.call().name(), outcome, invocation.elapsedMs());
        eventBus.publish(DeskmindEvent.of("tool.invoked", state.taskId(), state.subtaskIndex(),
                Map.of("tool", invocation.call().name(),
                        "outcome", outcome,
                        "output", abbreviate(invocation.output()))));
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 197) + "...";
    }
}
