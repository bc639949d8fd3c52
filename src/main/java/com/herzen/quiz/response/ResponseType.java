package com.herzen.quiz.response;

import java.util.Arrays;
import java.util.Optional;

public enum ResponseType {
    GREETING("greeting"),
    REPHRASE("rephrase"),
    RULES("rules"),
    ANSWER_QUESTION("answer_question"),
    PLEASE_RETRY("please_retry"),
    PLEASE_RETRY_LIMITS("please_retry_limits"),
    INCORRECT("incorrect"),
    CORRECT("correct"),
    GAME_COMPLETE("game_complete"),
    CHOOSE_NEXT_TOPIC("choose_next_topic"),
    ALREADY_ANSWERED("already_answered"),
    QUIT("quit");

    private final String key;

    ResponseType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ResponseType> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
    }
}
