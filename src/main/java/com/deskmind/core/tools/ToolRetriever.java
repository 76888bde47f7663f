package com.deskmind.core.tools;

import java.util.List;

/**
 * Similarity search over tool descriptions, used to build the tool-selecting
 * executor's shortlist.
 */
public interface ToolRetriever {

    /**
     * @return at most {@code k} tool description texts ("name: description"), best match first
     */
    List<String> topK(String query, int k);
}
