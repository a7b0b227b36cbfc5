package io.github.drompincen.javacron.runtime.script;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class VariableDiff {

    private VariableDiff() {}

    /**
     * Keys added or changed in {@code after} become upserts; keys missing from {@code after}
     * become deletions. The bookkeeping key is ignored on both sides.
     */
    public static VariableChanges between(Map<String, String> before, Map<String, String> after) {
        Map<String, String> upserts = new LinkedHashMap<>();
        Set<String> deletions = new LinkedHashSet<>();

        after.forEach((key, value) -> {
            if (WorkDir.UPDATED_KEY.equals(key)) return;
            if (!before.containsKey(key) || !Objects.equals(before.get(key), value)) {
                upserts.put(key, value);
            }
        });
        for (String key : before.keySet()) {
            if (!WorkDir.UPDATED_KEY.equals(key) && !after.containsKey(key)) {
                deletions.add(key);
            }
        }
        return new VariableChanges(upserts, deletions);
    }
}
