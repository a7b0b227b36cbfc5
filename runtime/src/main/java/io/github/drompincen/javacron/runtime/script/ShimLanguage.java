package io.github.drompincen.javacron.runtime.script;

import io.github.drompincen.javacron.protocol.api.EventType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Per-language helper table. Every shim exposes the same functions over the same work-dir files,
 * so the read-back after a run does not depend on the language.
 */
public enum ShimLanguage {

    BASH("script.sh", "bash", "/shim/javacron.sh"),
    PYTHON("script.py", "python3", "/shim/javacron.py"),
    NODE("script.js", "node", "/shim/javacron.js");

    private final String scriptFile;
    private final String interpreter;
    private final String resource;
    private volatile String shimSource;

    ShimLanguage(String scriptFile, String interpreter, String resource) {
        this.scriptFile = scriptFile;
        this.interpreter = interpreter;
        this.resource = resource;
    }

    public static ShimLanguage forEvent(EventType type) {
        return switch (type) {
            case BASH -> BASH;
            case PYTHON -> PYTHON;
            case NODEJS -> NODE;
            default -> throw new IllegalArgumentException("Not a script event type: " + type);
        };
    }

    public String scriptFile() { return scriptFile; }
    public String interpreter() { return interpreter; }

    public String shimSource() {
        String source = shimSource;
        if (source == null) {
            try (InputStream in = ShimLanguage.class.getResourceAsStream(resource)) {
                if (in == null) throw new IllegalStateException("Missing shim resource " + resource);
                source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load shim " + resource, e);
            }
            shimSource = source;
        }
        return source;
    }

    /** Shim first, then the user's source. */
    public String compose(String userScript) {
        String shim = shimSource();
        StringBuilder sb = new StringBuilder(shim.length() + (userScript == null ? 0 : userScript.length()) + 1);
        sb.append(shim);
        if (!shim.endsWith("\n")) sb.append('\n');
        if (userScript != null) sb.append(userScript);
        return sb.toString();
    }
}
