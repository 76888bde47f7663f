package com.deskmind.core.human;

import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory holder of tasks stopped at a human confirmation gate.
 * <p>
 * Per task it keeps the state snapshot of the gate waiting for an answer, if any, and
 * the most recent answer with the result it produced, so a repeated answer can be
 * replayed instead of transitioning twice. Answering a gate drops its snapshot and
 * replaces the previous answer.
 */
@Component
public class SuspendedTaskStore {

    private static final Logger log = LoggerFactory.getLogger(SuspendedTaskStore.class);

    /** A gate waiting for an answer. */
    public record PendingGate(int gateNumber, Map<String, Object> state, TaskResult result) {
        public PendingGate {
            state = Collections.unmodifiableMap(new HashMap<>(state));
        }
    }

    /** An answered gate. */
    public record Resolution(int gateNumber, HumanDecision decision, TaskResult result) {}

    private record Entry(PendingGate pending, Resolution lastResolution) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public void suspend(String taskId, int gateNumber, Map<String, Object> state, TaskResult result) {
        entries.compute(taskId, (id, existing) -> new Entry(
                new PendingGate(gateNumber, state, result),
                existing == null ? null : existing.lastResolution()));
        log.info("Task {} suspended at gate {}", taskId, gateNumber);
    }

    public Optional<PendingGate> pending(String taskId) {
        Entry entry = entries.get(taskId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.pending());
    }

    /** The answer recorded for {@code gateNumber}, when it is the most recently answered gate. */
    public Optional<Resolution> resolution(String taskId, int gateNumber) {
        Entry entry = entries.get(taskId);
        if (entry == null || entry.lastResolution() == null) {
            return Optional.empty();
        }
        Resolution last = entry.lastResolution();
        return last.gateNumber() == gateNumber ? Optional.of(last) : Optional.empty();
    }

    /** The most recently answered gate number, or 0 when none was answered. */
    public int lastResolvedGate(String taskId) {
        Entry entry = entries.get(taskId);
        return entry == null || entry.lastResolution() == null ? 0 : entry.lastResolution().gateNumber();
    }

    /** Number of tasks currently waiting for an answer. */
    public int pendingCount() {
        return (int) entries.values().stream().filter(entry -> entry.pending() != null).count();
    }

    /**
     * Records the answer to {@code gateNumber}. The pending snapshot is dropped when it
     * belongs to the answered gate; a later suspension of the same task adds a new one.
     */
    public void resolve(String taskId, int gateNumber, HumanDecision decision, TaskResult result) {
        entries.compute(taskId, (id, existing) -> {
            PendingGate pending = existing == null ? null : existing.pending();
            if (pending != null && pending.gateNumber() == gateNumber) {
                pending = null;
            }
            return new Entry(pending, new Resolution(gateNumber, decision, result));
        });
        log.info("Task {} gate {} resolved with {}", taskId, gateNumber, decision);
    }
}
