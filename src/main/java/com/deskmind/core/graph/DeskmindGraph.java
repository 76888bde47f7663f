package com.deskmind.core.graph;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.model.Route;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.nodes.*;
import com.deskmind.core.state.ExecutionState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * one Deskmind task from routing to a terminal state.
 * <pre>
 *   START -> route_request -> [routeAfterRouter]
 *            -> converse -> END
 *            -> verify_result                      (resumed after a human answer)
 *            -> plan_subtask -> [routeAfterPlan]
 *               -> converse -> END
 *               -> conclude -> END
 *               -> select_tool | generate_code -> invoke_tools -> verify_result
 *                  -> apply_policy -> [routeAfterPolicy]
 *                     -> plan_subtask | select_tool | generate_code | conclude
 *                     -> confirm_with_user -> [routeAfterConfirm]
 *                        -> verify_result
 *                        -> conclude -> END     (suspended, waiting for the user)
 * </pre>
 */
@Component
public class DeskmindGraph {

    private static final Logger log = LoggerFactory.getLogger(DeskmindGraph.class);

    private final CompiledGraph<ExecutionState> compiledGraph;

    public DeskmindGraph(
            RouteRequestNode routeNode,
            PlanSubtaskNode planNode,
            ConverseNode converseNode,
            SelectToolNode selectToolNode,
            GenerateCodeNode generateCodeNode,
            InvokeToolsNode invokeToolsNode,
            VerifyResultNode verifyNode,
            ApplyPolicyNode policyNode,
            ConfirmWithUserNode confirmNode,
            ConcludeTaskNode concludeNode,
            EngineProperties properties) throws Exception {

        var graph = new StateGraph<>(ExecutionState.SCHEMA, ExecutionState::new)
                .addNode("route_request", node_async(routeNode::apply))
                .addNode("plan_subtask", node_async(planNode::apply))
                .addNode("converse", node_async(converseNode::apply))
                .addNode("select_tool", node_async(selectToolNode::apply))
                .addNode("generate_code", node_async(generateCodeNode::apply))
                .addNode("invoke_tools", node_async(invokeToolsNode::apply))
                .addNode("verify_result", node_async(verifyNode::apply))
                .addNode("apply_policy", node_async(policyNode::apply))
                .addNode("confirm_with_user", node_async(confirmNode::apply))
                .addNode("conclude", node_async(concludeNode::apply))
                .addEdge(START, "route_request")
                .addConditionalEdges("route_request",
                        edge_async(this::routeAfterRouter),
                        Map.of("converse", "converse",
                                "plan_subtask", "plan_subtask",
                                "verify_result", "verify_result"))
                .addConditionalEdges("plan_subtask",
                        edge_async(this::routeAfterPlan),
                        Map.of("select_tool", "select_tool",
                                "generate_code", "generate_code",
                                "converse", "converse",
                                "conclude", "conclude"))
                .addEdge("select_tool", "invoke_tools")
                .addEdge("generate_code", "invoke_tools")
                .addEdge("invoke_tools", "verify_result")
                .addEdge("verify_result", "apply_policy")
                .addConditionalEdges("apply_policy",
                        edge_async(this::routeAfterPolicy),
                        Map.of("plan_subtask", "plan_subtask",
                                "select_tool", "select_tool",
                                "generate_code", "generate_code",
                                "confirm_with_user", "confirm_with_user",
                                "conclude", "conclude"))
                .addConditionalEdges("confirm_with_user",
                        edge_async(this::routeAfterConfirm),
                        Map.of("verify_result", "verify_result",
                                "conclude", "conclude"))
                .addEdge("converse", END)
                .addEdge("conclude", END);

        this.compiledGraph = graph.compile();
        this.compiledGraph.setMaxIterations(properties.getRecursionLimit());
        log.info("Graph compiled (iteration limit {})", properties.getRecursionLimit());
    }

    /**
     * Resumed tasks go back to the verifier with the human's answer; new requests are
     * either answered directly or planned.
     */
    String routeAfterRouter(ExecutionState state) {
        if (state.humanDecision().isPresent()) {
            return "verify_result";
        }
        return state.route().orElse(Route.CONVERSATIONAL) == Route.TASK ? "plan_subtask" : "converse";
    }

    String routeAfterPlan(ExecutionState state) {
        return targetOrConclude(state.nextNode());
    }

    String routeAfterPolicy(ExecutionState state) {
        return targetOrConclude(state.nextNode());
    }

    String routeAfterConfirm(ExecutionState state) {
        if (state.status() == TaskStatus.AWAITING_HUMAN) {
            return "conclude";
        }
        return "verify_result";
    }

    private static String targetOrConclude(String nextNode) {
        return nextNode == null || nextNode.isBlank() ? "conclude" : nextNode;
    }

    public CompiledGraph<ExecutionState> getCompiledGraph() {
        return compiledGraph;
    }
}
