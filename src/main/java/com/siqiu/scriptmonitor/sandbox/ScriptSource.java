package com.siqiu.scriptmonitor.sandbox;

import org.graalvm.polyglot.Source;

/**
 * A user script prepared for evaluation. Scripts are evaluated as-is so that the completion value of
 * the last statement becomes the result; a script that only parses as a function body (top-level
 * {@code return} or {@code await}) is wrapped in an async arrow function and its return value is used.
 */
final class ScriptSource {

    static final String NAME = "script.js";

    private static final String WRAP_PREFIX = "(async () => {\n";
    private static final String WRAP_SUFFIX = "\n})()";

    private final String original;
    private final boolean wrapped;

    private ScriptSource(String original, boolean wrapped) {
        this.original = original;
        this.wrapped = wrapped;
    }

    static ScriptSource of(String script) {
        return new ScriptSource(script == null ? "" : script, false);
    }

    ScriptSource asFunctionBody() {
        return wrapped ? this : new ScriptSource(original, true);
    }

    Source toSource() {
        String code = wrapped ? WRAP_PREFIX + original + WRAP_SUFFIX : original;
        return Source.newBuilder("js", code, NAME).buildLiteral();
    }

    String original() {
        return original;
    }

    boolean isWrapped() {
        return wrapped;
    }

    /** Map a 1-based line of the evaluated code back to the user's script. */
    int originalLine(int evaluatedLine) {
        int line = wrapped ? evaluatedLine - 1 : evaluatedLine;
        return Math.max(1, line);
    }
}
