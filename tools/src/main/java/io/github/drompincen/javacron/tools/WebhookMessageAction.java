package io.github.drompincen.javacron.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.javacron.runtime.tools.ToolAction;
import io.github.drompincen.javacron.runtime.tools.ToolActionContext;
import io.github.drompincen.javacron.runtime.tools.ToolActionResult;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Base for message actions that POST a JSON document to a webhook URL held in the tool's
 * credentials. Subclasses only build the body.
 */
public abstract class WebhookMessageAction implements ToolAction {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private ObjectMapper mapper = new ObjectMapper();
    private HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    public void setObjectMapper(ObjectMapper mapper) { this.mapper = mapper; }

    public void setHttpClient(HttpClient client) { this.client = client; }

    protected ObjectMapper mapper() { return mapper; }

    @Override public boolean sendsMessages() { return true; }

    /** Credential names tried in order for the target URL. */
    protected String[] urlCredentials() {
        return new String[] {"webhookUrl"};
    }

    /** Returns the JSON body to send, or throws {@link IllegalArgumentException} for bad input. */
    protected abstract ObjectNode buildBody(JsonNode parameters);

    /** Extra request headers, e.g. a shared secret. */
    protected Map<String, String> headers(ToolActionContext ctx) {
        return Map.of();
    }

    @Override
    public ToolActionResult execute(ToolActionContext ctx, JsonNode parameters) {
        String url = null;
        for (String name : urlCredentials()) {
            url = ctx.credential(name);
            if (url != null && !url.isBlank()) break;
        }
        if (url == null || url.isBlank()) {
            return ToolActionResult.failure("Webhook URL not found in credentials");
        }

        ObjectNode body;
        try {
            body = buildBody(parameters);
        } catch (IllegalArgumentException e) {
            return ToolActionResult.failure(e.getMessage());
        }

        try {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
            headers(ctx).forEach(request::header);

            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return ToolActionResult.failure(toolType() + " webhook returned HTTP " + response.statusCode()
                        + ": " + truncate(response.body()));
            }
            ObjectNode output = mapper.createObjectNode();
            output.put("ok", true);
            output.put("status", response.statusCode());
            return ToolActionResult.success(output);
        } catch (IOException | IllegalArgumentException e) {
            return ToolActionResult.failure(toolType() + " webhook failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolActionResult.failure(toolType() + " webhook interrupted");
        }
    }

    /** First non-blank text among {@code names}, or null. */
    protected static String text(JsonNode parameters, String... names) {
        for (String name : names) {
            JsonNode node = parameters.get(name);
            if (node != null && node.isTextual() && !node.asText().isBlank()) return node.asText();
        }
        return null;
    }

    /** {@code name} as text, or its first element when it is an array. */
    protected static String firstText(JsonNode parameters, String name) {
        JsonNode node = parameters.get(name);
        if (node == null || node.isNull()) return null;
        if (node.isArray()) return node.size() == 0 ? null : node.get(0).asText();
        return node.asText();
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }
}
