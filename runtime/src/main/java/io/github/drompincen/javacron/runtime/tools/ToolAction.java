package io.github.drompincen.javacron.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An action a tool integration can perform. Implementations are discovered through
 * {@link java.util.ServiceLoader} and receive Spring beans through single-argument setters.
 */
public interface ToolAction {

    /** Tool type this action belongs to, lower case, e.g. {@code slack}. */
    String toolType();

    String actionId();

    String description();

    /** Whether the action can deliver a conditional-action message. */
    default boolean sendsMessages() {
        return false;
    }

    ToolActionResult execute(ToolActionContext ctx, JsonNode parameters);
}
