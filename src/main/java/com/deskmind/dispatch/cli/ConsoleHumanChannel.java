package com.deskmind.dispatch.cli;

import com.deskmind.core.human.HumanChannel;
import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.HumanReply;
import org.springframework.stereotype.Component;

/**
 * {@link HumanChannel} on the terminal. The first word of the answer is the
 * decision; anything after it is passed on as context, e.g.
 * {@code no, open the scientific calculator}.
 */
@Component
public class ConsoleHumanChannel implements HumanChannel {

    private final ConsoleInput input;

    public ConsoleHumanChannel(ConsoleInput input) {
        this.input = input;
    }

    @Override
    public HumanReply ask(String prompt) {
        ConsoleOutput.question(prompt);
        return parse(input.readLine());
    }

    static HumanReply parse(String line) {
        if (line == null || line.isBlank()) {
            return new HumanReply(HumanDecision.ABORT, "");
        }
        String[] parts = line.trim().split("[\\s,;:]+", 2);
        HumanDecision decision = HumanDecision.parse(parts[0]);
        String context = parts.length > 1 ? parts[1].trim() : "";
        return new HumanReply(decision, context);
    }
}
