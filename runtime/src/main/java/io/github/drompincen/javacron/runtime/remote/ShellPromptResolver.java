package io.github.drompincen.javacron.runtime.remote;

import java.util.regex.Pattern;

/**
 * Turns a raw {@code PS1} value into a displayable prompt using the known user, host and directory.
 */
public final class ShellPromptResolver {

    private static final Pattern COLOR_CODES = Pattern.compile("\\\\(033|e)\\[[0-9;]*m");

    private ShellPromptResolver() {}

    public static String render(String ps1, String user, String host, String workingDirectory) {
        String cwd = workingDirectory == null || workingDirectory.isBlank() ? "~" : workingDirectory.trim();
        if (ps1 == null || ps1.isBlank()) {
            return fallback(user, host, cwd);
        }
        String shortHost = host.contains(".") ? host.substring(0, host.indexOf('.')) : host;
        String prompt = ps1.trim();
        prompt = prompt.replace("\\u", user)
                .replace("\\h", shortHost)
                .replace("\\H", host)
                .replace("\\w", tildeHome(cwd, user))
                .replace("\\W", baseName(cwd))
                .replace("\\$", "root".equals(user) ? "#" : "$")
                .replace("\\[", "")
                .replace("\\]", "");
        return COLOR_CODES.matcher(prompt).replaceAll("");
    }

    public static String fallback(String user, String host, String workingDirectory) {
        String cwd = workingDirectory == null || workingDirectory.isBlank() ? "~" : workingDirectory.trim();
        return user + "@" + host + ":" + tildeHome(cwd, user) + ("root".equals(user) ? "# " : "$ ");
    }

    static String tildeHome(String cwd, String user) {
        String home = "root".equals(user) ? "/root" : "/home/" + user;
        if (cwd.equals(home)) return "~";
        if (cwd.startsWith(home + "/")) return "~" + cwd.substring(home.length());
        return cwd;
    }

    private static String baseName(String cwd) {
        if ("/".equals(cwd)) return "/";
        int slash = cwd.lastIndexOf('/');
        String name = slash >= 0 ? cwd.substring(slash + 1) : cwd;
        return name.isEmpty() ? "~" : name;
    }
}
