package io.github.drompincen.javacron.protocol.api;

import java.util.Map;

public record HttpRequestSpec(
        String method,
        String url,
        Map<String, String> headers,
        String body
) {}
