package io.github.drompincen.javacron.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Posts to a Slack incoming webhook. {@code text} (or the conditional-action {@code message})
 * and {@code blocks} are accepted; a channel may come from {@code channel} or the first recipient.
 */
public class SlackSendMessageAction extends WebhookMessageAction {

    @Override public String toolType() { return "slack"; }
    @Override public String actionId() { return "send-message"; }
    @Override public String description() { return "Send a message to a Slack channel or user"; }

    @Override
    protected ObjectNode buildBody(JsonNode parameters) {
        ObjectNode body = mapper().createObjectNode();
        String channel = text(parameters, "channel");
        if (channel == null) channel = firstText(parameters, "recipients");
        if (channel != null && !channel.isBlank()) {
            body.put("channel", channel);
        }

        String text = text(parameters, "text", "message");
        String blocks = text(parameters, "blocks");
        if (blocks != null) {
            body.set("blocks", parseBlocks(blocks));
        } else if (text == null) {
            throw new IllegalArgumentException("Either text or blocks must be provided");
        }
        if (text != null) body.put("text", text);
        return body;
    }

    private JsonNode parseBlocks(String raw) {
        try {
            JsonNode parsed = mapper().readTree(raw);
            if (parsed.isArray()) return parsed;
            if (parsed.has("blocks") && parsed.get("blocks").isArray()) return parsed.get("blocks");
            throw new IllegalArgumentException("Invalid blocks format. Expected an array or object with 'blocks' property.");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse blocks JSON: " + e.getOriginalMessage());
        }
    }
}
