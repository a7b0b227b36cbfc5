package io.github.drompincen.javacron.runtime.remote;

public record CommandResult(
        String stdout,
        String stderr,
        Integer exitCode,
        boolean timedOut
) {
    public static CommandResult failure(String stderr) {
        return new CommandResult("", stderr, null, false);
    }

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(stdout, stderr, -1, true);
    }

    public boolean success() {
        return !timedOut && exitCode != null && exitCode == 0;
    }
}
