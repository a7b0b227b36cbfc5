package io.github.drompincen.javacron.runtime.remote;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds POSIX command lines from argv. Every argument goes through {@link #quote(String)}; callers
 * never concatenate user content into a command themselves.
 */
public final class PosixShell {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");
    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PosixShell() {}

    public static String quote(String arg) {
        if (arg == null || arg.isEmpty()) return "''";
        if (SAFE.matcher(arg).matches()) return arg;
        return "'" + arg.replace("'", "'\"'\"'") + "'";
    }

    public static String command(String... argv) {
        return command(List.of(argv));
    }

    public static String command(List<String> argv) {
        return argv.stream().map(PosixShell::quote).collect(Collectors.joining(" "));
    }

    public static boolean isValidEnvName(String name) {
        return name != null && ENV_NAME.matcher(name).matches();
    }
}
