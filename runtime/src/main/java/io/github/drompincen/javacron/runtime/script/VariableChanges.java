package io.github.drompincen.javacron.runtime.script;

import java.util.Map;
import java.util.Set;

public record VariableChanges(Map<String, String> upserts, Set<String> deletions) {

    public static final VariableChanges NONE = new VariableChanges(Map.of(), Set.of());

    public boolean isEmpty() {
        return upserts.isEmpty() && deletions.isEmpty();
    }
}
