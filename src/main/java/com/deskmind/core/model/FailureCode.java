package com.deskmind.core.model;

/**
 * Distinguishes the reasons a task ends in terminal failure.
 */
public enum FailureCode {
    NONE("Done."),
    RETRY_BUDGET_EXHAUSTED("I could not complete this step after several attempts."),
    VERIFIER_FAILURE("The last step failed and cannot be recovered."),
    USER_ABORT("Stopped at your request."),
    COLLABORATOR_UNAVAILABLE("The language model or tools are not responding, so I had to stop."),
    SUBTASK_LIMIT_REACHED("The request needed more steps than I am allowed to take."),
    ENGINE_ERROR("Something went wrong while running this request.");

    private final String message;

    FailureCode(String message) {
        this.message = message;
    }

    /** Readable default message shown to the user. */
    public String message() {
        return message;
    }
}
