package com.herzen.quiz.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * One text template per {@link ResponseType}. A template set missing any type is rejected on construction.
 */
public final class ResponseTemplates implements ResponseFormatter {
    private static final ResponseTemplates DEFAULTS = new ResponseTemplates(Map.ofEntries(
            Map.entry("greeting", "Hello! Today we play #NAME. Want to join?"),
            Map.entry("rephrase", "I don't understand"),
            Map.entry("rules", "Choose a topic from: #TOPICS. Answer a question. Get your score when all topics are complete"),
            Map.entry("answer_question", "Next question: #QUESTION"),
            Map.entry("please_retry", "That is incorrect. Try again"),
            Map.entry("please_retry_limits", "That is incorrect. Try again. #LEFT attempts left"),
            Map.entry("incorrect", "That is incorrect"),
            Map.entry("correct", "That is correct. Your score: #SCORE"),
            Map.entry("game_complete", "Game is complete. Your score: #SCORE"),
            Map.entry("choose_next_topic", "Choose the next topic"),
            Map.entry("already_answered", "You already answered this topic"),
            Map.entry("quit", "Ok... Goodbye!")
    ));

    private final Map<ResponseType, String> templates;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ResponseTemplates(Map<String, String> byKey) {
        Objects.requireNonNull(byKey, "templates");
        EnumMap<ResponseType, String> parsed = new EnumMap<>(ResponseType.class);
        for (Map.Entry<String, String> e : byKey.entrySet()) {
            ResponseType type = ResponseType.fromKey(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown response template: " + e.getKey()));
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Response template " + e.getKey() + " is null");
            }
            parsed.put(type, e.getValue());
        }
        List<String> missing = Arrays.stream(ResponseType.values())
                .filter(t -> !parsed.containsKey(t))
                .map(ResponseType::key)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing response templates: " + String.join(", ", missing));
        }
        this.templates = Collections.unmodifiableMap(parsed);
    }

    public static ResponseTemplates defaults() {
        return DEFAULTS;
    }

    @Override
    public String format(ResponseMessage message) {
        String text = templates.get(message.type());
        for (Map.Entry<String, String> p : message.placeholders().entrySet()) {
            text = text.replace(p.getKey(), p.getValue());
        }
        return text;
    }

    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        templates.forEach((type, template) -> out.put(type.key(), template));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResponseTemplates other && templates.equals(other.templates);
    }

    @Override
    public int hashCode() {
        return templates.hashCode();
    }
}
