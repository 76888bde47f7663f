package com.deskmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Locale;
import java.util.Set;

/**
 * CLI command: deskmind shell
 * <p>
 * Interactive loop reading one request per line until {@code exit}, {@code quit},
 * {@code q} or end of input.
 */
@Command(name = "shell", mixinStandardHelpOptions = true, description = "Start an interactive session")
@Component
public class ShellCommand implements Runnable {

    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit", "q");

    @Option(names = {"--verbose", "-v"}, description = "Print engine events while tasks run")
    private boolean verbose;

    private final TaskConversation conversation;
    private final ConsoleInput input;

    public ShellCommand(TaskConversation conversation, ConsoleInput input) {
        this.conversation = conversation;
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Type a request, or 'exit' to leave.");
        while (true) {
            System.out.print("deskmind> ");
            System.out.flush();
            String line = input.readLine();
            if (line == null || EXIT_WORDS.contains(line.trim().toLowerCase(Locale.ROOT))) {
                ConsoleOutput.info("Bye.");
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            try {
                ConsoleOutput.outcome(conversation.handle(line.trim(), verbose));
            } catch (Exception e) {
                ConsoleOutput.error("Task failed: " + AskCommand.rootCauseMessage(e));
            }
        }
    }
}
