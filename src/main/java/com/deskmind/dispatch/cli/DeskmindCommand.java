package com.deskmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Deskmind.
 * Routes to subcommands: ask, shell, tools.
 */
@Command(
        name = "deskmind",
        mixinStandardHelpOptions = true,
        version = "Deskmind 0.1.0",
        description = "Desktop assistant powered by LangGraph4j and Spring AI",
        subcommands = {
                AskCommand.class,
                ShellCommand.class,
                ToolsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DeskmindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
