package com.herzen.quiz.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.dialog.SessionModels.PlayerMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class MessengerPayloadParser {
    private static final Set<String> SUPPORTED_OBJECTS = Set.of("page", "instagram");

    public List<PlayerMessage> parse(JsonNode root) {
        if (root == null || !SUPPORTED_OBJECTS.contains(root.path("object").asText(""))) {
            return List.of();
        }

        List<PlayerMessage> result = new ArrayList<>();
        for (JsonNode entry : root.path("entry")) {
            for (JsonNode item : entry.path("messaging")) {
                JsonNode message = item.path("message");
                if (!message.isObject() || message.has("is_echo")) continue;

                JsonNode from = item.path("sender").path("id");
                JsonNode to = item.path("recipient").path("id");
                JsonNode text = message.path("text");
                if (from.isTextual() && to.isTextual() && text.isTextual()) {
                    result.add(new PlayerMessage(new PlayerId(to.asText(), from.asText()), text.asText()));
                }
            }
        }
        return result;
    }
}
