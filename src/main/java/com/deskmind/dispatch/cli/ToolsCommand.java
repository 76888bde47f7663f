package com.deskmind.dispatch.cli;

import com.deskmind.core.tools.ToolRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: deskmind tools
 * <p>
 * Lists the tools in the registry.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List available tools")
@Component
public class ToolsCommand implements Runnable {

    private final ToolRegistry toolRegistry;

    public ToolsCommand(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public void run() {
        var tools = toolRegistry.listTools();
        if (tools.isEmpty()) {
            ConsoleOutput.info("No tools registered.");
            return;
        }
        ConsoleOutput.info(tools.size() + " tool(s) available:");
        tools.forEach(ConsoleOutput::tool);
    }
}
