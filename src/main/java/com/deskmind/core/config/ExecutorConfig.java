package com.deskmind.core.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Worker pools for the two places the engine leaves the task's own thread:
 * tool invocation and completion calls.
 * <p>
 * Both pools copy the submitting thread's MDC so task ids survive the hop.
 */
@Configuration
public class ExecutorConfig {

    private final EngineProperties properties;

    public ExecutorConfig(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Bounded pool for concurrent tool calls of one assistant turn.
     */
    @Bean(name = "toolExecutor")
    public Executor toolExecutor() {
        int parallelism = Math.max(1, properties.getToolParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("tool-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    @Bean(name = "completionExecutor")
    public Executor completionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(32);
        executor.setThreadNamePrefix("llm-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    }
                }
            };
        };
    }
}
