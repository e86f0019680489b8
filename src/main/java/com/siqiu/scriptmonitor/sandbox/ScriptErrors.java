package com.siqiu.scriptmonitor.sandbox;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.SourceSection;
import org.graalvm.polyglot.Value;

import java.util.Map;

/**
 * Builds the structured error payloads stored on execution records.
 */
final class ScriptErrors {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final int PREVIEW_HEAD_LINES = 10;
    private static final int PREVIEW_CONTEXT_LINES = 2;

    private static final Map<String, String> SUGGESTIONS = Map.of(
            "syntax_error", "Check for missing semicolons, brackets, or invalid syntax",
            "reference_error", "Check for undefined variables or functions",
            "type_error", "Check for incorrect data types or null/undefined values"
    );

    private ScriptErrors() {}

    /**
     * Describe an exception raised by script code (uncaught throw, failed assertion, syntax error).
     */
    static ObjectNode failure(PolyglotException e, ScriptSource source) {
        String name;
        String message;
        boolean errorObject = false;

        if (e.isSyntaxError()) {
            name = "SyntaxError";
            message = e.getMessage();
        } else {
            Value guest = e.getGuestObject();
            if (guest != null && guest.hasMembers() && guest.hasMember("name") && guest.hasMember("message")) {
                name = guest.getMember("name").toString();
                message = guest.getMember("message").toString();
                errorObject = true;
            } else {
                name = "Uncaught";
                message = e.getMessage();
            }
        }

        String type = typeOf(name, errorObject);
        ObjectNode node = JSON.objectNode();
        node.put("type", type);
        node.put("name", name);
        node.put("message", message);

        SourceSection location = scriptLocation(e);
        Integer line = null;
        if (location != null && location.hasLines()) {
            line = source.originalLine(location.getStartLine());
            node.put("line", line);
            if (location.hasColumns()) {
                node.put("column", location.getStartColumn());
            }
        }
        String suggestion = SUGGESTIONS.get(type);
        if (suggestion != null) {
            node.put("suggestion", suggestion);
        }
        node.set("scriptPreview", preview(source.original(), line));
        return node;
    }

    /**
     * Describe a rejected promise whose reason is not an exception object ({@code throw "text"}).
     */
    static ObjectNode thrownValue(String name, String message, ScriptSource source) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "exception");
        node.put("name", name);
        node.put("message", message);
        node.set("scriptPreview", preview(source.original(), null));
        return node;
    }

    static ObjectNode unsettled(ScriptSource source) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "runtime_error");
        node.put("name", "Error");
        node.put("message", "script result promise never settled");
        node.set("scriptPreview", preview(source.original(), null));
        return node;
    }

    static ObjectNode unserializable(ScriptSource source) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "runtime_error");
        node.put("name", "TypeError");
        node.put("message", "script result could not be converted to JSON");
        node.set("scriptPreview", preview(source.original(), null));
        return node;
    }

    static ObjectNode resourceExceeded(GuardLimit limit, String message) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "resource_exceeded");
        node.put("limit", limit.label());
        node.put("message", message);
        return node;
    }

    static ObjectNode timeout(String message) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "timeout");
        node.put("message", message);
        return node;
    }

    static ObjectNode engineError(String message) {
        ObjectNode node = JSON.objectNode();
        node.put("type", "engine_error");
        node.put("message", message == null ? "interpreter fault" : message);
        return node;
    }

    /**
     * Lines around {@code errorLine} (1-based), or the first lines of the script when unknown.
     */
    static ObjectNode preview(String script, Integer errorLine) {
        String[] lines = script.split("\\R", -1);
        int total = lines.length;
        int start;
        int end;
        if (errorLine != null) {
            int idx = Math.min(errorLine, total) - 1;
            start = Math.max(0, idx - PREVIEW_CONTEXT_LINES);
            end = Math.min(total, idx + PREVIEW_CONTEXT_LINES + 1);
        } else {
            start = 0;
            end = Math.min(PREVIEW_HEAD_LINES, total);
        }

        ArrayNode shown = JSON.arrayNode();
        for (int i = start; i < end; i++) {
            ObjectNode l = shown.addObject();
            l.put("line", i + 1);
            l.put("content", lines[i]);
            l.put("isError", errorLine != null && errorLine == i + 1);
        }

        ObjectNode node = JSON.objectNode();
        node.set("lines", shown);
        node.put("totalLines", total);
        node.put("showingRange", (start + 1) + "-" + end);
        return node;
    }

    static boolean isStackOverflow(PolyglotException e) {
        String message = e.getMessage();
        return message != null && message.contains("Maximum call stack size exceeded");
    }

    private static String typeOf(String name, boolean errorObject) {
        switch (name) {
            case "SyntaxError":
                return "syntax_error";
            case "ReferenceError":
                return "reference_error";
            case "TypeError":
                return "type_error";
            case "AssertionError":
            case "ExpectationError":
                return "assertion_error";
            default:
                return errorObject ? "runtime_error" : "exception";
        }
    }

    // first frame inside the user's script; helper frames from the prelude are skipped
    private static SourceSection scriptLocation(PolyglotException e) {
        SourceSection location = e.getSourceLocation();
        if (isScript(location)) {
            return location;
        }
        for (PolyglotException.StackFrame frame : e.getPolyglotStackTrace()) {
            if (frame.isGuestFrame() && isScript(frame.getSourceLocation())) {
                return frame.getSourceLocation();
            }
        }
        return null;
    }

    private static boolean isScript(SourceSection section) {
        return section != null && section.getSource() != null && ScriptSource.NAME.equals(section.getSource().getName());
    }
}
