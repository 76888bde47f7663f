package com.deskmind.core.policy;

/**
 * Where the orchestrator goes after a policy transition.
 */
public enum NextNode {
    PLANNER("plan_subtask"),
    TOOL_SELECTING("select_tool"),
    CODE_GENERATING("generate_code"),
    HUMAN_GATE("confirm_with_user"),
    TERMINAL_FAILURE("conclude");

    private final String graphNode;

    NextNode(String graphNode) {
        this.graphNode = graphNode;
    }

    /** Name of the graph node this target maps to. */
    public String graphNode() {
        return graphNode;
    }
}
