package io.github.drompincen.javacron.runtime.script;

import java.time.Duration;
import java.util.Map;

public record ScriptRunRequest(
        String userId,
        ShimLanguage language,
        String content,
        Map<String, Object> input,
        Map<String, Object> event,
        Map<String, String> variables,
        Map<String, String> environment,
        Duration timeout
) {}
