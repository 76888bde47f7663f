package com.deskmind.dispatch.cli;

import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.TaskResult;
import com.deskmind.core.model.ToolDescriptor;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Deskmind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DESKMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DESKMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void question(String prompt) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(magenta) [CONFIRM]|@ " + prompt));
        System.out.print("> ");
        System.out.flush();
    }

    public static void tool(ToolDescriptor tool) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + tool.name() + "|@  " + tool.description()));
    }

    public static void event(DeskmindEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.created" -> "@|fg(cyan) [TASK]|@";
            case "subtask.planned" -> "@|bold,fg(yellow) [PLAN]|@";
            case "tool.invoked" -> "@|fg(blue) [TOOL]|@";
            case "verdict.issued" -> "@|fg(magenta) [VERDICT]|@";
            case "task.suspended" -> "@|fg(yellow) [WAITING]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + summarize(event)));
    }

    public static void outcome(TaskResult result) {
        System.out.println();
        switch (result.status()) {
            case COMPLETED -> success(result.finalMessage());
            case AWAITING_HUMAN -> info("Waiting for your answer (task " + result.taskId() + ")");
            default -> error(result.finalMessage()
                    + (result.failureCode() == FailureCode.NONE ? "" : " [" + result.failureCode() + "]"));
        }
    }

    private static String summarize(DeskmindEvent event) {
        var payload = event.payload();
        return switch (event.eventType()) {
            case "task.created" -> event.taskId() + " " + payload.getOrDefault("request", "");
            case "subtask.planned" -> "#" + event.subtaskIndex() + " " + payload.get("description")
                    + " (" + payload.get("executor") + ")";
            case "tool.invoked" -> payload.get("tool") + " " + payload.get("outcome") + ": " + payload.get("output");
            case "verdict.issued" -> payload.get("verdict") + " " + payload.get("reason");
            case "task.suspended" -> "gate " + payload.get("gate");
            case "task.failed" -> String.valueOf(payload.get("failureCode"));
            default -> event.taskId();
        };
    }
}
