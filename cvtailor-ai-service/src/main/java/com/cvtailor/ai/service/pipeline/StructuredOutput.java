package com.cvtailor.ai.service.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts the JSON object from a model reply. Models sometimes wrap it in a
 * markdown fence or surround it with prose; the outermost {...} span is used.
 */
final class StructuredOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StructuredOutput() {
    }

    /**
     * @throws IllegalArgumentException when no JSON object can be read
     */
    static Map<String, Object> parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("empty reply");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("no JSON object in reply");
        }
        try {
            return MAPPER.readValue(text.substring(start, end + 1), new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String string(Map<String, Object> map, String field) {
        Object value = map.get(field);
        return value == null ? null : value.toString().trim();
    }

    // Accepts a JSON array of strings or a single comma separated string
    static List<String> strings(Map<String, Object> map, String field) {
        Object value = map.get(field);
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString().trim());
                }
            }
        } else if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise prompt context", e);
        }
    }
}
