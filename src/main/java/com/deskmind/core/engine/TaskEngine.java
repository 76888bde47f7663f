package com.deskmind.core.engine;

import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.graph.DeskmindGraph;
import com.deskmind.core.human.SuspendedTaskStore;
import com.deskmind.core.logging.MdcContext;
import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.TaskResult;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the orchestration engine: runs a request through the
 * LangGraph4j graph and resumes tasks suspended at a human gate.
 * <p>
 * Every run starts from a fresh state. A task stopped with status AWAITING_HUMAN is
 * parked in the {@link SuspendedTaskStore} until {@link #resume} supplies the answer;
 * its snapshot is dropped once the answer is applied. Resuming the last answered gate
 * with the same decision replays the recorded result instead of transitioning again.
 */
@Service
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);
    private static final AtomicInteger TASK_COUNTER = new AtomicInteger(0);

    private final DeskmindGraph graph;
    private final SuspendedTaskStore suspendedTasks;
    private final EventBus eventBus;
    private final DeskmindMetrics metrics;
    private final ConcurrentHashMap<String, Object> taskLocks = new ConcurrentHashMap<>();

    public TaskEngine(DeskmindGraph graph, SuspendedTaskStore suspendedTasks,
                      EventBus eventBus, DeskmindMetrics metrics) {
        this.graph = graph;
        this.suspendedTasks = suspendedTasks;
        this.eventBus = eventBus;
        this.metrics = metrics;
        metrics.trackSuspendedTasks(suspendedTasks::pendingCount);
    }

    /**
     * Runs a new task for {@code taskText}.
     *
     * @return the outcome; status AWAITING_HUMAN when the task stopped at a gate
     */
    public TaskResult run(String taskText) {
        String taskId = generateTaskId();
        String request = taskText == null ? "" : taskText;
        MdcContext.setTask(taskId);
        try {
            log.info("Starting task {}: {}", taskId, request);
            eventBus.publish(DeskmindEvent.of("task.created", taskId, Map.of("request", request)));

            var initialState = new HashMap<String, Object>();
            initialState.put("taskId", taskId);
            initialState.put("request", request);
            initialState.put("status", TaskStatus.ROUTING.name());
            initialState.put("transcript", List.of(Turn.user(request)));

            Run run = execute(taskId, initialState);
            if (run.result().awaitingHuman()) {
                suspendedTasks.suspend(taskId, run.result().gateNumber(), run.state(), run.result());
            }
            return run.result();
        } finally {
            MdcContext.clear();
        }
    }

    /** Answers the gate the task is currently waiting at. */
    public TaskResult resume(String taskId, HumanDecision decision) {
        return resume(taskId, decision, "");
    }

    /**
     * Answers the gate the task is currently waiting at. When the task is no longer
     * waiting, the call is matched against the last answered gate.
     */
    public TaskResult resume(String taskId, HumanDecision decision, String context) {
        int gate = suspendedTasks.pending(taskId)
                .map(SuspendedTaskStore.PendingGate::gateNumber)
                .orElseGet(() -> suspendedTasks.lastResolvedGate(taskId));
        if (gate == 0) {
            throw new TaskNotSuspendedException(taskId, "Task " + taskId + " is not waiting for an answer");
        }
        return resume(taskId, gate, decision, context);
    }

    /**
     * Answers gate {@code gateNumber} of the task.
     *
     * Only the most recently answered gate can be replayed; the resume lock of a task
     * is released once nothing is pending for it.
     *
     * @throws TaskNotSuspendedException when the task is not waiting at that gate, or the
     *                                   gate was already answered with another decision
     */
    public TaskResult resume(String taskId, int gateNumber, HumanDecision decision, String context) {
        Object lock = taskLocks.computeIfAbsent(taskId, id -> new Object());
        synchronized (lock) {
            try {
                return resumeLocked(taskId, gateNumber, decision, context);
            } finally {
                if (suspendedTasks.pending(taskId).isEmpty()) {
                    taskLocks.remove(taskId, lock);
                }
            }
        }
    }

    private TaskResult resumeLocked(String taskId, int gateNumber, HumanDecision decision, String context) {
        Optional<SuspendedTaskStore.Resolution> resolved = suspendedTasks.resolution(taskId, gateNumber);
        if (resolved.isPresent()) {
            if (resolved.get().decision() == decision) {
                log.info("Gate {} of task {} already answered {}, replaying result", gateNumber, taskId, decision);
                return resolved.get().result();
            }
            throw new TaskNotSuspendedException(taskId, "Gate " + gateNumber + " of task " + taskId
                    + " was already answered " + resolved.get().decision());
        }

        SuspendedTaskStore.PendingGate pending = suspendedTasks.pending(taskId)
                .filter(p -> p.gateNumber() == gateNumber)
                .orElseThrow(() -> new TaskNotSuspendedException(taskId,
                        "Task " + taskId + " is not waiting at gate " + gateNumber));

        MdcContext.setTask(taskId);
        try {
            log.info("Resuming task {} at gate {} with {}", taskId, gateNumber, decision);
            var state = new HashMap<>(pending.state());
            state.put("humanDecision", decision.name());
            state.put("humanContext", context == null ? "" : context);
            state.put("status", TaskStatus.VERIFYING.name());
            metrics.recordHumanGate(decision.name());

            Run run = execute(taskId, state);
            suspendedTasks.resolve(taskId, gateNumber, decision, run.result());
            if (run.result().awaitingHuman()) {
                suspendedTasks.suspend(taskId, run.result().gateNumber(), run.state(), run.result());
            }
            return run.result();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique task ID in the format DESK-YYYY-NNNN.
     */
    public String generateTaskId() {
        int count = TASK_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("DESK-%d-%04d", year, count);
    }

    /** Result of one graph invocation plus the final state snapshot. */
    private record Run(TaskResult result, Map<String, Object> state) {}

    private Run execute(String taskId, Map<String, Object> inputs) {
        long start = System.currentTimeMillis();
        ExecutionState finalState;
        try {
            var config = RunnableConfig.builder()
                    .threadId(taskId)
                    .build();
            finalState = graph.getCompiledGraph()
                    .invoke(inputs, config)
                    .orElseThrow(() -> new IllegalStateException("Graph returned no state for task " + taskId));
        } catch (Exception e) {
            log.error("Task {} failed with an unexpected error", taskId, e);
            return engineError(taskId, inputs, e);
        }

        TaskResult result = toResult(finalState);
        log.info("Task {} finished as {} ({}) in {}ms", taskId, result.status(), result.failureCode(),
                System.currentTimeMillis() - start);
        publishOutcome(result);
        return new Run(result, Collections.unmodifiableMap(new HashMap<>(finalState.data())));
    }

    private Run engineError(String taskId, Map<String, Object> inputs, Exception e) {
        ExecutionState partial = new ExecutionState(inputs);
        String message = FailureCode.ENGINE_ERROR.message();
        var transcript = new ArrayList<>(partial.transcript());
        transcript.add(Turn.assistant(message));
        TaskResult result = new TaskResult(taskId, TaskStatus.FAILED, FailureCode.ENGINE_ERROR, message,
                transcript, partial.gateCount());
        eventBus.publish(DeskmindEvent.of("task.failed", taskId,
                Map.of("failureCode", FailureCode.ENGINE_ERROR.name(),
                        "error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())));
        metrics.recordTaskResult(TaskStatus.FAILED.name(), FailureCode.ENGINE_ERROR.name());
        return new Run(result, Map.of());
    }

    static TaskResult toResult(ExecutionState state) {
        TaskStatus status = state.status();
        if (!status.isTerminal() && status != TaskStatus.AWAITING_HUMAN) {
            // graph ended without a terminal node, e.g. a conversational reply
            status = state.failureCode() == FailureCode.NONE ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        }
        return new TaskResult(state.taskId(), status, state.failureCode(), state.finalMessage(),
                state.transcript(), state.gateCount());
    }

    private void publishOutcome(TaskResult result) {
        switch (result.status()) {
            case AWAITING_HUMAN -> { }
            case COMPLETED -> {
                metrics.recordTaskResult(result.status().name(), result.failureCode().name());
                eventBus.publish(DeskmindEvent.of("task.completed", result.taskId(),
                        Map.of("message", result.finalMessage())));
            }
            default -> {
                metrics.recordTaskResult(result.status().name(), result.failureCode().name());
                eventBus.publish(DeskmindEvent.of("task.failed", result.taskId(),
                        Map.of("failureCode", result.failureCode().name(), "message", result.finalMessage())));
            }
        }
    }
}
