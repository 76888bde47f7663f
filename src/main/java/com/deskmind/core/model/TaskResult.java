package com.deskmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * What the engine hands back for a task run or resume.
 *
 * @param taskId       the task identifier (needed to resume a suspended task)
 * @param status       COMPLETED, FAILED or AWAITING_HUMAN
 * @param failureCode  NONE unless the task failed
 * @param finalMessage readable outcome (final executor output, failure text or pending question)
 * @param transcript   the transcript at the time the run stopped
 * @param gateNumber   number of human gates reached so far
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    FailureCode failureCode,
    String finalMessage,
    List<Turn> transcript,
    int gateNumber
) implements Serializable {

    public TaskResult {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }

    public boolean awaitingHuman() {
        return status == TaskStatus.AWAITING_HUMAN;
    }
}
