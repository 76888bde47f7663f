package com.deskmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for Deskmind task execution.
 */
@Service
public class DeskmindMetrics {

    private final MeterRegistry registry;

    public DeskmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String status, String failureCode) {
        Counter.builder("deskmind.tasks.total")
                .tag("status", status)
                .tag("failure", failureCode)
                .register(registry)
                .increment();
    }

    public void recordVerdict(String verdict, String executorKind) {
        Counter.builder("deskmind.verdicts.total")
                .tag("verdict", verdict)
                .tag("executor", executorKind)
                .register(registry)
                .increment();
    }

    public void incrementRetries(String executorKind) {
        Counter.builder("deskmind.retries.total")
                .tag("executor", executorKind)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "verdict" for an explicit ESCALATE, "budget" when tool retries ran out
     */
    public void incrementEscalations(String reason) {
        Counter.builder("deskmind.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "ok", "error", "timeout" or "unavailable"
     */
    public void recordToolInvocation(String toolName, String outcome, long ms) {
        Timer.builder("deskmind.tool.duration")
                .tag("tool", toolName)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubtaskCount(int count) {
        DistributionSummary.builder("deskmind.task.subtasks")
                .description("Subtasks completed per task")
                .register(registry)
                .record(count);
    }

    public void recordHumanGate(String decision) {
        Counter.builder("deskmind.human_gate.total")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void trackSuspendedTasks(Supplier<Number> pendingCount) {
        Gauge.builder("deskmind.tasks.suspended", pendingCount)
                .description("Tasks waiting at a human confirmation gate")
                .strongReference(true)
                .register(registry);
    }
}
