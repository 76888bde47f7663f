package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.ReplyParser;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import com.deskmind.core.tools.ToolRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tool-selecting executor: picks registered tools for the current subtask.
 * <p>
 * The prompt lists a shortlist from the {@link ToolRetriever}, never the
 * code-execution tool. At least one call is always emitted; a reply without a
 * readable call becomes {@code no_op}.
 */
@Component
public class SelectToolNode extends ExecutorNode {

    private static final Logger log = LoggerFactory.getLogger(SelectToolNode.class);

    private static final String SYSTEM_PROMPT = """
            You operate a desktop by calling tools. Choose the tool call(s) that accomplish the
            current step. Only use tools from this list:
            %s
            Reply with JSON only, either one call or a list of calls:
              {"name": "<tool name>", "args": {"<arg>": "<value>"}}
            If none of the tools fits, reply {"name": "no_op", "args": {}}.
            """;

    private final ToolRetriever toolRetriever;
    private final int shortlistSize;
    private final String codeToolName;

    public SelectToolNode(CompletionService completionService,
                          ToolRetriever toolRetriever,
                          EngineProperties properties) {
        super(completionService);
        this.toolRetriever = toolRetriever;
        this.shortlistSize = properties.getToolShortlistSize();
        this.codeToolName = properties.getCodeToolName();
    }

    @Override
    protected ExecutorKind kind() {
        return ExecutorKind.TOOL_SELECTING;
    }

    @Override
    protected Attempt act(ExecutionState state) {
        String objective = objective(state);
        List<String> shortlist = shortlist(objective);
        String systemPrompt = String.format(SYSTEM_PROMPT, shortlist.isEmpty()
                ? "(no tools available)"
                : shortlist.stream().map(t -> "- " + t).collect(Collectors.joining("\n")));

        var window = new ArrayList<>(state.recentTurns(10));
        window.add(Turn.user("Current step: " + objective + "\n" + feedback(state)));

        String reply = completionService.complete(systemPrompt, window);
        List<ToolCall> calls = ReplyParser.parseToolCalls(reply);
        if (calls.isEmpty()) {
            log.info("No tool call found in reply, emitting no_op");
            calls = List.of(ToolCall.noOp("no tool call in reply"));
        } else {
            calls = withUniqueIds(calls);
        }
        log.info("Selected {} tool call(s): {}", calls.size(),
                calls.stream().map(ToolCall::name).collect(Collectors.joining(", ")));
        return Attempt.of(Turn.assistant("", calls));
    }

    private List<String> shortlist(String objective) {
        return toolRetriever.topK(objective, shortlistSize + 1).stream()
                .filter(text -> !text.startsWith(codeToolName + ":"))
                .limit(shortlistSize)
                .toList();
    }

    private static List<ToolCall> withUniqueIds(List<ToolCall> calls) {
        var renumbered = new ArrayList<ToolCall>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            renumbered.add(new ToolCall("call_" + i, call.name(), call.args()));
        }
        return renumbered;
    }
}
