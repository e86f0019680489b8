package com.siqiu.scriptmonitor.alert;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.siqiu.scriptmonitor.execution.ExecutionRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predicate on one field of the script's result payload. A missing field or a non-success record
 * (which has no result) never satisfies the condition.
 */
public class ResultFieldCondition implements AlertCondition {

    private final String path;
    private final JsonPointer pointer;
    private final Comparison comparison;
    private final String expected;

    public ResultFieldCondition(String path, Comparison comparison, String expected) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("result-field rule requires field_path");
        }
        this.path = path;
        this.pointer = JsonPointer.compile(toPointer(path.trim()));
        this.comparison = comparison;
        this.expected = expected == null ? "" : expected;
    }

    @Override
    public Evaluation evaluate(ExecutionRecord record) {
        JsonNode actual = lookup(record);
        if (actual == null) {
            return Evaluation.CLEARED;
        }
        return matches(actual) ? Evaluation.SATISFIED : Evaluation.CLEARED;
    }

    @Override
    public String describe() {
        return "result" + pointer + " " + comparison.symbol() + " " + expected;
    }

    @Override
    public Map<String, Object> matchedData(ExecutionRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("field", path);
        JsonNode actual = lookup(record);
        data.put("actual", actual == null ? null : actual.isValueNode() ? actual.asText() : actual.toString());
        data.put("expected", expected);
        return data;
    }

    private JsonNode lookup(ExecutionRecord record) {
        if (record.result() == null) return null;
        JsonNode node = record.result().at(pointer);
        return node.isMissingNode() ? null : node;
    }

    private boolean matches(JsonNode actual) {
        if (actual.isNumber()) {
            try {
                return comparison.test(actual.asDouble(), Double.parseDouble(expected.trim()));
            } catch (NumberFormatException e) {
                return comparison.test(actual.asText(), expected);
            }
        }
        if (actual.isNull()) {
            return comparison.test("null", expected);
        }
        if (actual.isValueNode()) {
            return comparison.test(actual.asText(), expected);
        }
        return comparison.test(actual.toString(), expected);
    }

    private static String toPointer(String path) {
        if (path.startsWith("/")) return path;
        return "/" + path.replace("~", "~0").replace("/", "~1").replace('.', '/');
    }
}
