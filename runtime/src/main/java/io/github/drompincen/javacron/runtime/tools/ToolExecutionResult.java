package io.github.drompincen.javacron.runtime.tools;

/**
 * Process-style view of a tool action run, as job handling expects it.
 */
public record ToolExecutionResult(int exitCode, String stdout, String stderr) {

    public static ToolExecutionResult failed(String stderr) {
        return new ToolExecutionResult(1, "", stderr);
    }

    public boolean success() {
        return exitCode == 0;
    }
}
