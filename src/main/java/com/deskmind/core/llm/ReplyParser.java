package com.deskmind.core.llm;

import com.deskmind.core.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for free-text model replies: fenced blocks, JSON objects
 * embedded in prose, and the several tool-call shapes models like to emit.
 */
public final class ReplyParser {

    private static final Logger log = LoggerFactory.getLogger(ReplyParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z0-9_+-]*\\s*\\n?(.*?)```", Pattern.DOTALL);

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private ReplyParser() {
        // utility class
    }

    /**
     * Returns the body of the first fenced block, or the trimmed text when the
     * reply has no complete fence. A dangling opening fence is dropped.
     */
    public static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline < 0 ? "" : cleaned.substring(newline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    /**
     * Reads the reply as JSON. Falls back to the outermost {@code {...}} or
     * {@code [...]} span when the JSON is wrapped in prose.
     */
    public static Optional<JsonNode> readJson(String text) {
        String cleaned = stripFences(text);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        Optional<JsonNode> direct = tryRead(cleaned);
        if (direct.isPresent()) {
            return direct;
        }
        for (char[] pair : new char[][]{{'{', '}'}, {'[', ']'}}) {
            int from = cleaned.indexOf(pair[0]);
            int to = cleaned.lastIndexOf(pair[1]);
            if (from >= 0 && to > from) {
                Optional<JsonNode> embedded = tryRead(cleaned.substring(from, to + 1));
                if (embedded.isPresent()) {
                    return embedded;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #readJson} but throws when nothing parses.
     */
    public static JsonNode requireJson(String text) {
        return readJson(text).orElseThrow(() ->
                new LlmParseException("Reply is not JSON: " + abbreviate(text)));
    }

    /**
     * Extracts tool calls from a reply. Accepts {@code {"name","args"}},
     * {@code {"name","arguments"}}, OpenAI style {@code {"function":{...}}}, a list
     * of those, or a {@code {"tool_calls":[...]}} wrapper, optionally behind a
     * {@code functools} prefix. Ids are assigned as {@code call_0}, {@code call_1}, ...
     *
     * @return the calls in reply order; empty when the reply holds none
     */
    public static List<ToolCall> parseToolCalls(String text) {
        String cleaned = stripFences(text);
        if (cleaned.startsWith("functools")) {
            cleaned = cleaned.substring("functools".length()).trim();
        }
        Optional<JsonNode> json = readJson(cleaned);
        if (json.isEmpty()) {
            return List.of();
        }
        JsonNode root = json.get();
        if (root.has("tool_calls")) {
            root = root.get("tool_calls");
        }

        var calls = new ArrayList<ToolCall>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                toToolCall(element, calls.size()).ifPresent(calls::add);
            }
        } else {
            toToolCall(root, 0).ifPresent(calls::add);
        }
        return calls;
    }

    /**
     * Source text for the code-execution tool: the first fenced block, or the
     * whole reply when it is not fenced.
     */
    public static String extractCode(String text) {
        return stripFences(text);
    }

    /** First whitespace-delimited word, stripped of surrounding punctuation. */
    public static String firstWord(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = stripFences(text);
        if (trimmed.isEmpty()) {
            return "";
        }
        String word = trimmed.split("\\s+", 2)[0];
        return word.replaceAll("^[^A-Za-z_]+|[^A-Za-z_]+$", "");
    }

    /** Everything after the first word, trimmed. */
    public static String afterFirstWord(String text) {
        String trimmed = stripFences(text);
        String[] parts = trimmed.split("\\s+", 2);
        return parts.length < 2 ? "" : parts[1].trim();
    }

    private static Optional<ToolCall> toToolCall(JsonNode node, int position) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode source = node.has("function") && node.get("function").isObject() ? node.get("function") : node;
        JsonNode name = source.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            return Optional.empty();
        }
        JsonNode args = source.has("args") ? source.get("args") : source.get("arguments");
        String id = node.hasNonNull("id") ? node.get("id").asText() : "call_" + position;
        return Optional.of(new ToolCall(id, name.asText().trim(), toArgs(args)));
    }

    private static Map<String, Object> toArgs(JsonNode args) {
        if (args == null || args.isNull()) {
            return Map.of();
        }
        JsonNode node = args;
        if (args.isTextual()) {
            Optional<JsonNode> nested = tryRead(args.asText());
            if (nested.isEmpty() || !nested.get().isObject()) {
                return Map.of("input", args.asText());
            }
            node = nested.get();
        }
        if (!node.isObject()) {
            return Map.of("input", node.toString());
        }
        return new LinkedHashMap<>(MAPPER.convertValue(node, ARGS_TYPE));
    }

    private static Optional<JsonNode> tryRead(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            if (node == null || node.isMissingNode() || node.isValueNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.trace("Not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
