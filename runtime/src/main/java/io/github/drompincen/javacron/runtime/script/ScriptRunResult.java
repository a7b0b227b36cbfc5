package io.github.drompincen.javacron.runtime.script;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one script run. {@code output} and {@code condition} are null when the script did
 * not write them.
 */
public record ScriptRunResult(
        String stdout,
        String stderr,
        Integer exitCode,
        boolean timedOut,
        JsonNode output,
        Boolean condition,
        VariableChanges variableChanges
) {
    public static ScriptRunResult failure(String stderr) {
        return new ScriptRunResult("", stderr, null, false, null, null, VariableChanges.NONE);
    }

    public boolean success() {
        return !timedOut && exitCode != null && exitCode == 0;
    }
}
