package com.zzf.localagent.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for pulling JSON out of free-form model replies.
 */
public final class JsonUtils {
    private static final Pattern FENCED_JSON = Pattern.compile("(?s)```(?:json|JSON)?\\s*(\\{.*?\\})\\s*```");

    private JsonUtils() {}

    /**
     * Returns the first JSON object found in {@code raw}: the content of a fenced block when
     * there is one, otherwise the first balanced {@code {...}} span.
     *
     * @throws IllegalArgumentException when no complete object is present
     */
    public static String extractFirstJsonObject(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw is null");
        }
        Matcher fenced = FENCED_JSON.matcher(raw);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        int start = raw.indexOf('{');
        if (start < 0) {
            throw new IllegalArgumentException("no json object found");
        }
        return balancedObject(raw, start);
    }

    private static String balancedObject(String text, int startIndex) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = startIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(startIndex, i + 1);
                }
            }
        }
        throw new IllegalArgumentException("unterminated json");
    }

    /**
     * Non-blank, trimmed text elements of the array at {@code field}. Missing or non-array
     * fields yield an empty list.
     */
    public static List<String> textList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        if (node == null) {
            return out;
        }
        JsonNode array = node.path(field);
        if (!array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            String value = item.asText("").trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return out;
    }
}
