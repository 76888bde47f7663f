package com.deskmind.core.model;

import java.io.Serializable;

/**
 * One planner-issued unit of work.
 *
 * @param description  what the executor should accomplish
 * @param executorKind which executor handles it
 * @param index        zero-based position within the task
 */
public record Subtask(
    String description,
    ExecutorKind executorKind,
    int index
) implements Serializable {}
