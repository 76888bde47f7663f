package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.ReplyParser;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Code-generating executor: writes a Python script for the current subtask and
 * emits exactly one call to the code-execution tool.
 * <p>
 * Accepts a proper tool call in the reply, otherwise uses the first fenced block
 * (or the raw reply) as the script.
 */
@Component
public class GenerateCodeNode extends ExecutorNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateCodeNode.class);

    private static final String SYSTEM_PROMPT = """
            You are a Python programmer on the user's desktop. Write one self-contained Python 3
            script that accomplishes the current step and prints its result.
            Use only the standard library. Reply with the code in a single ```python block.
            """;

    private final String codeToolName;

    public GenerateCodeNode(CompletionService completionService, EngineProperties properties) {
        super(completionService);
        this.codeToolName = properties.getCodeToolName();
    }

    @Override
    protected ExecutorKind kind() {
        return ExecutorKind.CODE_GENERATING;
    }

    @Override
    protected Attempt act(ExecutionState state) {
        var window = new ArrayList<>(state.recentTurns(10));
        window.add(Turn.user("Current step: " + objective(state) + "\n" + feedback(state)));

        String reply = completionService.complete(SYSTEM_PROMPT, window);
        String code = codeFrom(reply);
        log.info("Generated {} line(s) of code", code.lines().count());
        ToolCall call = new ToolCall("call_0", codeToolName, Map.of("code", code));
        return Attempt.of(Turn.assistant("", List.of(call)));
    }

    private String codeFrom(String reply) {
        for (ToolCall call : ReplyParser.parseToolCalls(reply)) {
            Object code = call.args().get("code");
            if (codeToolName.equals(call.name()) && code != null) {
                return code.toString();
            }
        }
        return ReplyParser.extractCode(reply);
    }
}
