package com.deskmind.core.config;

import com.deskmind.core.human.HumanMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestration engine settings, bound from {@code deskmind.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "deskmind.engine")
public class EngineProperties {

    /** Retries per executor kind before escalation or failure. */
    private int maxRetries = 2;

    /** Number of recent transcript turns the verifier sees. */
    private int verifierWindow = 5;

    /** How many tool descriptions the tool-selecting executor is shown. */
    private int toolShortlistSize = 5;

    /** Subtasks a single task may plan before it is stopped. */
    private int maxSubtasks = 10;

    /** Upper bound on graph node executions for one run. */
    private int recursionLimit = 400;

    private Duration completionTimeout = Duration.ofSeconds(60);

    private Duration toolTimeout = Duration.ofSeconds(30);

    private int toolParallelism = 4;

    /** Name of the single tool the code-generating executor may call. */
    private String codeToolName = "run_python";

    private HumanMode humanMode = HumanMode.BLOCKING;

    private List<String> greetingKeywords = new ArrayList<>(List.of(
            "hi", "hello", "hey", "hiya", "howdy", "yo", "greetings",
            "good", "morning", "afternoon", "evening", "there", "thanks", "thank", "you"));

    private List<String> taskKeywords = new ArrayList<>(List.of(
            "open", "launch", "start", "run", "execute", "close", "stop", "kill",
            "create", "delete", "remove", "move", "copy", "rename",
            "search", "download", "calculate", "compute", "play", "show", "list",
            "restart", "shutdown", "install", "ping", "translate", "summarize"));

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getVerifierWindow() {
        return verifierWindow;
    }

    public void setVerifierWindow(int verifierWindow) {
        this.verifierWindow = verifierWindow;
    }

    public int getToolShortlistSize() {
        return toolShortlistSize;
    }

    public void setToolShortlistSize(int toolShortlistSize) {
        this.toolShortlistSize = toolShortlistSize;
    }

    public int getMaxSubtasks() {
        return maxSubtasks;
    }

    public void setMaxSubtasks(int maxSubtasks) {
        this.maxSubtasks = maxSubtasks;
    }

    public int getRecursionLimit() {
        return recursionLimit;
    }

    public void setRecursionLimit(int recursionLimit) {
        this.recursionLimit = recursionLimit;
    }

    public Duration getCompletionTimeout() {
        return completionTimeout;
    }

    public void setCompletionTimeout(Duration completionTimeout) {
        this.completionTimeout = completionTimeout;
    }

    public Duration getToolTimeout() {
        return toolTimeout;
    }

    public void setToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
    }

    public int getToolParallelism() {
        return toolParallelism;
    }

    public void setToolParallelism(int toolParallelism) {
        this.toolParallelism = toolParallelism;
    }

    public String getCodeToolName() {
        return codeToolName;
    }

    public void setCodeToolName(String codeToolName) {
        this.codeToolName = codeToolName;
    }

    public HumanMode getHumanMode() {
        return humanMode;
    }

    public void setHumanMode(HumanMode humanMode) {
        this.humanMode = humanMode;
    }

    public List<String> getGreetingKeywords() {
        return greetingKeywords;
    }

    public void setGreetingKeywords(List<String> greetingKeywords) {
        this.greetingKeywords = greetingKeywords;
    }

    public List<String> getTaskKeywords() {
        return taskKeywords;
    }

    public void setTaskKeywords(List<String> taskKeywords) {
        this.taskKeywords = taskKeywords;
    }
}
