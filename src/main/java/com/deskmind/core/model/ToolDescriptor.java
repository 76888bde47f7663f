package com.deskmind.core.model;

import java.io.Serializable;

/**
 * Catalog entry of the tool registry.
 */
public record ToolDescriptor(
    String name,
    String description
) implements Serializable {

    /** "name: description" form used in prompts and retrieval. */
    public String asText() {
        return name + ": " + description;
    }
}
