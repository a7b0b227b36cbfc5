package io.github.drompincen.javacron.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.javacron.runtime.tools.ToolActionContext;

import java.util.Map;

/**
 * Generic JSON webhook. Sends {@code message}, plus {@code subject} and {@code recipients} when
 * present; a {@code secret} credential goes out as {@code X-Webhook-Secret}.
 */
public class WebhookSendMessageAction extends WebhookMessageAction {

    @Override public String toolType() { return "webhook"; }
    @Override public String actionId() { return "send-message"; }
    @Override public String description() { return "POST a JSON message to a webhook URL"; }

    @Override
    protected String[] urlCredentials() {
        return new String[] {"url", "webhookUrl"};
    }

    @Override
    protected ObjectNode buildBody(JsonNode parameters) {
        String message = text(parameters, "message", "text");
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        ObjectNode body = mapper().createObjectNode();
        body.put("message", message);
        String subject = text(parameters, "subject");
        if (subject != null) body.put("subject", subject);
        JsonNode recipients = parameters.get("recipients");
        if (recipients != null && recipients.isArray()) body.set("recipients", recipients);
        return body;
    }

    @Override
    protected Map<String, String> headers(ToolActionContext ctx) {
        String secret = ctx.credential("secret");
        return secret == null || secret.isBlank() ? Map.of() : Map.of("X-Webhook-Secret", secret);
    }
}
