package com.deskmind.core.model;

/**
 * Author of a {@link Turn} in the transcript.
 */
public enum Role {
    USER,
    ASSISTANT,
    TOOL,
    SYSTEM
}
