package com.deskmind.core.state;

import com.deskmind.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Graph state for one Deskmind task.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every channel is a
 * last-write-wins base channel: nodes that grow the transcript return the whole new
 * list (see {@link #appendTurns}), so a node never has to rely on reducer
 * de-duplication to keep two identical turns.
 */
public class ExecutionState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Task identity ────────────────────────────────────────────
        Map.entry("taskId",               Channels.base(() -> "")),
        Map.entry("request",              Channels.base(() -> "")),
        Map.entry("route",                Channels.base(() -> "")),
        Map.entry("status",               Channels.base(() -> TaskStatus.ROUTING.name())),

        // ── Conversation ─────────────────────────────────────────────
        Map.entry("transcript",           Channels.base((Supplier<List<Turn>>) List::of)),

        // ── Subtask progress ─────────────────────────────────────────
        Map.entry("subtaskIndex",         Channels.base(() -> 0)),
        Map.entry("currentSubtask",       Channels.base((Reducer<Subtask>) null)),
        Map.entry("completedSubtasks",    Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("currentExecutorKind",  Channels.base(() -> "")),
        Map.entry("userContext",          Channels.base(() -> "")),

        // ── Verification and policy ──────────────────────────────────
        Map.entry("verifierDecision",     Channels.base(() -> "")),
        Map.entry("verifierReason",       Channels.base(() -> "")),
        Map.entry("retryCounters",        Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("attemptCounters",      Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("nextNode",             Channels.base(() -> "")),

        // ── Tool tracking (scoped to the current attempt) ────────────
        Map.entry("completedToolNames",   Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("unavailableTools",     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("attemptFailure",       Channels.base(() -> "")),
        Map.entry("collaboratorFailures", Channels.base(() -> 0)),

        // ── Human confirmation gate ──────────────────────────────────
        Map.entry("humanDecision",        Channels.base(() -> "")),
        Map.entry("humanContext",         Channels.base(() -> "")),
        Map.entry("gateCount",            Channels.base(() -> 0)),

        // ── Outcome ──────────────────────────────────────────────────
        Map.entry("failureCode",          Channels.base(() -> FailureCode.NONE.name())),
        Map.entry("finalMessage",         Channels.base(() -> ""))
    );

    public ExecutionState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String taskId() {
        return this.<String>value("taskId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    public Optional<Route> route() {
        String raw = this.<String>value("route").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(Route.valueOf(raw));
    }

    public TaskStatus status() {
        String raw = this.<String>value("status").orElse(TaskStatus.ROUTING.name());
        return TaskStatus.valueOf(raw);
    }

    public List<Turn> transcript() {
        return this.<List<Turn>>value("transcript").orElse(List.of());
    }

    public int subtaskIndex() {
        return this.<Integer>value("subtaskIndex").orElse(0);
    }

    public Optional<Subtask> currentSubtask() {
        return this.value("currentSubtask");
    }

    public List<String> completedSubtasks() {
        return this.<List<String>>value("completedSubtasks").orElse(List.of());
    }

    public Optional<ExecutorKind> currentExecutorKind() {
        String raw = this.<String>value("currentExecutorKind").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(ExecutorKind.valueOf(raw));
    }

    public String userContext() {
        return this.<String>value("userContext").orElse("");
    }

    public Optional<Verdict> verifierDecision() {
        String raw = this.<String>value("verifierDecision").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(Verdict.valueOf(raw));
    }

    public String verifierReason() {
        return this.<String>value("verifierReason").orElse("");
    }

    public Map<String, Integer> retryCounters() {
        return this.<Map<String, Integer>>value("retryCounters").orElse(Map.of());
    }

    public int retryCount(ExecutorKind kind) {
        return retryCounters().getOrDefault(kind.name(), 0);
    }

    public Map<String, Integer> attemptCounters() {
        return this.<Map<String, Integer>>value("attemptCounters").orElse(Map.of());
    }

    public int attemptCount(ExecutorKind kind) {
        return attemptCounters().getOrDefault(kind.name(), 0);
    }

    public String nextNode() {
        return this.<String>value("nextNode").orElse("");
    }

    public Set<String> completedToolNames() {
        return new TreeSet<>(this.<List<String>>value("completedToolNames").orElse(List.of()));
    }

    public List<String> unavailableTools() {
        return this.<List<String>>value("unavailableTools").orElse(List.of());
    }

    public String attemptFailure() {
        return this.<String>value("attemptFailure").orElse("");
    }

    public int collaboratorFailures() {
        return this.<Integer>value("collaboratorFailures").orElse(0);
    }

    public Optional<HumanDecision> humanDecision() {
        String raw = this.<String>value("humanDecision").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(HumanDecision.valueOf(raw));
    }

    public String humanContext() {
        return this.<String>value("humanContext").orElse("");
    }

    public int gateCount() {
        return this.<Integer>value("gateCount").orElse(0);
    }

    public FailureCode failureCode() {
        String raw = this.<String>value("failureCode").orElse(FailureCode.NONE.name());
        return FailureCode.valueOf(raw);
    }

    public String finalMessage() {
        return this.<String>value("finalMessage").orElse("");
    }

    // ── Derived views ────────────────────────────────────────────────

    /** The most recent turn, if any. */
    public Optional<Turn> lastTurn() {
        var turns = transcript();
        return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
    }

    /** The latest USER turn's text, or the original request when there is none. */
    public String latestUserText() {
        var turns = transcript();
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role() == Role.USER) {
                return turns.get(i).content();
            }
        }
        return request();
    }

    /** The last {@code size} turns of the transcript. */
    public List<Turn> recentTurns(int size) {
        var turns = transcript();
        int from = Math.max(0, turns.size() - Math.max(size, 0));
        return List.copyOf(turns.subList(from, turns.size()));
    }

    /** Turns produced since (and including) the latest ASSISTANT turn. */
    public List<Turn> turnsOfLastAttempt() {
        var turns = transcript();
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role() == Role.ASSISTANT) {
                return List.copyOf(turns.subList(i, turns.size()));
            }
        }
        return List.of();
    }

    // ── Update helpers ───────────────────────────────────────────────

    /** Returns a new transcript list with {@code turns} appended. */
    public List<Turn> appendTurns(List<Turn> turns) {
        var appended = new ArrayList<>(transcript());
        appended.addAll(turns);
        return List.copyOf(appended);
    }

    public List<Turn> appendTurn(Turn turn) {
        return appendTurns(List.of(turn));
    }

    /** Returns a copy of {@code counters} with {@code kind} incremented by one. */
    public static Map<String, Integer> increment(Map<String, Integer> counters, ExecutorKind kind) {
        var copy = new HashMap<>(counters);
        copy.merge(kind.name(), 1, Integer::sum);
        return Map.copyOf(copy);
    }
}
