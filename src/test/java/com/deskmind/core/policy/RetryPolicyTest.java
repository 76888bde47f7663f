package com.deskmind.core.policy;

import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(2);

    private static Map<String, Integer> retries(ExecutorKind kind, int count) {
        return Map.of(kind.name(), count);
    }

    @Nested
    @DisplayName("SUCCESS")
    class Success {

        @ParameterizedTest
        @EnumSource(value = ExecutorKind.class, names = {"TOOL_SELECTING", "CODE_GENERATING"})
        @DisplayName("advances to the planner and resets counters")
        void advances(ExecutorKind kind) {
            var t = policy.decide(Verdict.SUCCESS, kind, retries(kind, 2));
            assertEquals(NextNode.PLANNER, t.nextNode());
            assertEquals(CounterEffect.RESET_AND_ADVANCE, t.counterEffect());
            assertEquals(FailureCode.NONE, t.failureCode());
            assertFalse(t.isTerminal());
        }
    }

    @Nested
    @DisplayName("RETRY")
    class Retry {

        @Test
        @DisplayName("reruns tool selection while under budget")
        void rerunsToolSelection() {
            var t = policy.decide(Verdict.RETRY, ExecutorKind.TOOL_SELECTING, retries(ExecutorKind.TOOL_SELECTING, 1));
            assertEquals(NextNode.TOOL_SELECTING, t.nextNode());
            assertEquals(ExecutorKind.TOOL_SELECTING, t.executorKind());
            assertEquals(CounterEffect.INCREMENT, t.counterEffect());
        }

        @Test
        @DisplayName("escalates tool selection to code generation when the budget is spent")
        void escalatesWhenExhausted() {
            var t = policy.decide(Verdict.RETRY, ExecutorKind.TOOL_SELECTING, retries(ExecutorKind.TOOL_SELECTING, 2));
            assertEquals(NextNode.CODE_GENERATING, t.nextNode());
            assertEquals(ExecutorKind.CODE_GENERATING, t.executorKind());
            assertEquals(CounterEffect.NONE, t.counterEffect());
        }

        @Test
        @DisplayName("reruns code generation while under budget")
        void rerunsCodeGeneration() {
            var t = policy.decide(Verdict.RETRY, ExecutorKind.CODE_GENERATING, Map.of());
            assertEquals(NextNode.CODE_GENERATING, t.nextNode());
            assertEquals(CounterEffect.INCREMENT, t.counterEffect());
        }

        @Test
        @DisplayName("fails with RETRY_BUDGET_EXHAUSTED once code generation is spent")
        void failsWhenCodeGenerationExhausted() {
            var t = policy.decide(Verdict.RETRY, ExecutorKind.CODE_GENERATING, retries(ExecutorKind.CODE_GENERATING, 2));
            assertTrue(t.isTerminal());
            assertEquals(FailureCode.RETRY_BUDGET_EXHAUSTED, t.failureCode());
        }

        @Test
        @DisplayName("counters of other kinds do not consume the budget")
        void countersArePerKind() {
            var t = policy.decide(Verdict.RETRY, ExecutorKind.CODE_GENERATING, retries(ExecutorKind.TOOL_SELECTING, 5));
            assertEquals(NextNode.CODE_GENERATING, t.nextNode());
            assertEquals(CounterEffect.INCREMENT, t.counterEffect());
        }

        @Test
        @DisplayName("zero budget escalates on the first retry")
        void zeroBudget() {
            var strict = new RetryPolicy(0);
            var t = strict.decide(Verdict.RETRY, ExecutorKind.TOOL_SELECTING, Map.of());
            assertEquals(NextNode.CODE_GENERATING, t.nextNode());
        }
    }

    @Test
    @DisplayName("ESCALATE from tool selection goes to code generation regardless of counters")
    void escalateFromToolSelection() {
        var t = policy.decide(Verdict.ESCALATE, ExecutorKind.TOOL_SELECTING, Map.of());
        assertEquals(NextNode.CODE_GENERATING, t.nextNode());
        assertEquals(CounterEffect.NONE, t.counterEffect());
    }

    @Test
    @DisplayName("ESCALATE from code generation is handled as RETRY")
    void escalateFromCodeGeneration() {
        assertEquals(NextNode.CODE_GENERATING,
                policy.decide(Verdict.ESCALATE, ExecutorKind.CODE_GENERATING, Map.of()).nextNode());
        assertEquals(FailureCode.RETRY_BUDGET_EXHAUSTED,
                policy.decide(Verdict.ESCALATE, ExecutorKind.CODE_GENERATING,
                        retries(ExecutorKind.CODE_GENERATING, 2)).failureCode());
    }

    @Test
    @DisplayName("USER_VERIFIER routes to the human gate")
    void userVerifier() {
        var t = policy.decide(Verdict.USER_VERIFIER, ExecutorKind.TOOL_SELECTING, Map.of());
        assertEquals(NextNode.HUMAN_GATE, t.nextNode());
        assertEquals("confirm_with_user", t.nextNode().graphNode());
    }

    @Test
    @DisplayName("FAILURE is terminal with VERIFIER_FAILURE")
    void failure() {
        var t = policy.decide(Verdict.FAILURE, ExecutorKind.CODE_GENERATING, Map.of());
        assertTrue(t.isTerminal());
        assertEquals(FailureCode.VERIFIER_FAILURE, t.failureCode());
        assertEquals("conclude", t.nextNode().graphNode());
    }

    @Test
    @DisplayName("rejects a negative budget")
    void rejectsNegativeBudget() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1));
    }

    @Test
    @DisplayName("repeated RETRY verdicts always terminate within the bounded number of attempts")
    void retriesAlwaysTerminate() {
        var random = new Random(42);
        for (int run = 0; run < 200; run++) {
            int max = random.nextInt(4);
            var bounded = new RetryPolicy(max);
            var counters = new HashMap<String, Integer>();
            ExecutorKind kind = ExecutorKind.TOOL_SELECTING;
            int attempts = 1;
            while (true) {
                Verdict verdict = random.nextBoolean() ? Verdict.RETRY : Verdict.ESCALATE;
                var t = bounded.decide(verdict, kind, counters);
                if (t.isTerminal()) {
                    break;
                }
                if (t.counterEffect() == CounterEffect.INCREMENT) {
                    counters.merge(t.executorKind().name(), 1, Integer::sum);
                }
                kind = t.executorKind();
                attempts++;
                assertTrue(attempts <= 2 * (max + 1), "too many attempts for max=" + max);
            }
            assertEquals(ExecutorKind.CODE_GENERATING, kind);
        }
    }
}
