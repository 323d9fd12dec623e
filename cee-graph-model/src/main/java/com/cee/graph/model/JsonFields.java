package com.cee.graph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for reading typed fields out of a JSON object while keeping the rest as extras. */
final class JsonFields {

    private JsonFields() {
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Number (including NaN and Infinity) or null when absent or not numeric. */
    static Double number(JsonNode node) {
        if (isAbsent(node) || !node.isNumber()) return null;
        return node.doubleValue();
    }

    static String text(JsonNode node) {
        if (isAbsent(node) || !node.isTextual()) return null;
        return node.textValue();
    }

    static List<String> textList(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) return null;
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            out.add(element.asText());
        }
        return out;
    }

    /**
     * Copies every field of {@code object} whose name is not in {@code known}, plus known fields whose
     * value could not be read as the expected type, so they survive a write-back.
     */
    static Map<String, JsonNode> extras(JsonNode object, Map<String, Boolean> known) {
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Boolean consumed = known.get(e.getKey());
            if (consumed == null || !consumed) {
                extras.put(e.getKey(), e.getValue());
            }
        }
        return extras;
    }
}
