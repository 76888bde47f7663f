package com.deskmind.core.tools;

import com.deskmind.core.model.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Ranks tools by how many query words appear in their name or description.
 * Ties keep registry order, so the shortlist is stable for a given query.
 */
@Component
public class KeywordToolRetriever implements ToolRetriever {

    private final ToolRegistry registry;

    public KeywordToolRetriever(ToolRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<String> topK(String query, int k) {
        if (k <= 0) {
            return List.of();
        }
        Set<String> queryWords = words(query);
        List<ToolDescriptor> tools = registry.listTools();

        return IntStream.range(0, tools.size())
                .boxed()
                .sorted(Comparator.comparingInt((Integer i) -> -score(queryWords, tools.get(i)))
                        .thenComparingInt(i -> i))
                .limit(k)
                .map(i -> tools.get(i).asText())
                .toList();
    }

    private static int score(Set<String> queryWords, ToolDescriptor tool) {
        Set<String> toolWords = words(tool.name() + " " + tool.description());
        int score = 0;
        for (String word : queryWords) {
            if (toolWords.contains(word)) {
                score++;
            }
        }
        return score;
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> w.length() > 1)
                .collect(Collectors.toSet());
    }
}
