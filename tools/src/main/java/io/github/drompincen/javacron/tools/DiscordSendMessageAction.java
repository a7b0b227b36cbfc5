package io.github.drompincen.javacron.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Posts to a Discord channel webhook. Discord caps message content at 2000 characters.
 */
public class DiscordSendMessageAction extends WebhookMessageAction {

    static final int MAX_CONTENT = 2000;

    @Override public String toolType() { return "discord"; }
    @Override public String actionId() { return "send-message"; }
    @Override public String description() { return "Send a message to a Discord channel"; }

    @Override
    protected ObjectNode buildBody(JsonNode parameters) {
        String content = text(parameters, "content", "message");
        if (content == null) {
            throw new IllegalArgumentException("Message content is required");
        }
        if (content.length() > MAX_CONTENT) {
            content = content.substring(0, MAX_CONTENT - 3) + "...";
        }
        ObjectNode body = mapper().createObjectNode();
        body.put("content", content);
        String username = text(parameters, "username");
        if (username != null) body.put("username", username);
        String avatar = text(parameters, "avatarUrl", "avatar_url");
        if (avatar != null) body.put("avatar_url", avatar);
        return body;
    }
}
