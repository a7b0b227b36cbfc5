package io.github.drompincen.javacron.runtime.actions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data a message template renders against. Exposed to templates under the {@code javacron}
 * namespace: {@code javacron.event}, {@code javacron.getVariables}, {@code javacron.input},
 * {@code javacron.getCondition}.
 */
public record TemplateContext(
        Map<String, Object> event,
        Map<String, String> variables,
        Map<String, Object> input,
        Map<String, Boolean> conditions
) {
    public Map<String, Object> toModel() {
        Map<String, Object> namespace = new LinkedHashMap<>();
        namespace.put("event", event == null ? Map.of() : event);
        namespace.put("getVariables", variables == null ? Map.of() : variables);
        namespace.put("input", input == null ? Map.of() : input);
        namespace.put("getCondition", conditions == null ? Map.of() : conditions);
        return Map.of("javacron", namespace);
    }
}
