package com.deskmind.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorConfigTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("decorated tasks see the submitter's MDC and restore their own afterwards")
    void propagatesMdc() {
        MDC.put("taskId", "DESK-2026-0001");
        Runnable decorated = ExecutorConfig.mdcPropagating().decorate(
                () -> assertEquals("DESK-2026-0001", MDC.get("taskId")));

        MDC.clear();
        MDC.put("taskId", "other");
        decorated.run();

        assertEquals("other", MDC.get("taskId"));
    }

    @Test
    @DisplayName("the tool pool runs tasks with the configured parallelism")
    void toolPool() throws Exception {
        var properties = new EngineProperties();
        properties.setToolParallelism(3);
        var executor = (ThreadPoolTaskExecutor) new ExecutorConfig(properties).toolExecutor();
        try {
            MDC.put("taskId", "DESK-2026-0002");
            String seen = CompletableFuture.supplyAsync(() -> MDC.get("taskId"), executor)
                    .get(5, TimeUnit.SECONDS);

            assertEquals("DESK-2026-0002", seen);
            assertEquals(3, executor.getMaxPoolSize());
            assertTrue(executor.getThreadNamePrefix().startsWith("tool-"));
        } finally {
            executor.shutdown();
        }
    }
}
