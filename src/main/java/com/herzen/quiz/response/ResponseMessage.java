package com.herzen.quiz.response;

import java.util.List;
import java.util.Map;

public sealed interface ResponseMessage {
    ResponseMessage REPHRASE = new Rephrase();
    ResponseMessage PLEASE_RETRY = new PleaseRetry();
    ResponseMessage INCORRECT = new Incorrect();
    ResponseMessage CHOOSE_NEXT_TOPIC = new ChooseNextTopic();
    ResponseMessage ALREADY_ANSWERED = new AlreadyAnswered();
    ResponseMessage QUIT = new Quit();

    ResponseType type();

    default Map<String, String> placeholders() {
        return Map.of();
    }

    record Greeting(String name) implements ResponseMessage {
        public ResponseType type() { return ResponseType.GREETING; }
        public Map<String, String> placeholders() { return Map.of("#NAME", name); }
    }

    record Rephrase() implements ResponseMessage {
        public ResponseType type() { return ResponseType.REPHRASE; }
    }

    record Rules(List<String> topicKeys) implements ResponseMessage {
        public Rules {
            topicKeys = List.copyOf(topicKeys);
        }

        public ResponseType type() { return ResponseType.RULES; }
        public Map<String, String> placeholders() { return Map.of("#TOPICS", String.join(", ", topicKeys)); }
    }

    record AnswerQuestion(String text) implements ResponseMessage {
        public ResponseType type() { return ResponseType.ANSWER_QUESTION; }
        public Map<String, String> placeholders() { return Map.of("#QUESTION", text); }
    }

    record PleaseRetry() implements ResponseMessage {
        public ResponseType type() { return ResponseType.PLEASE_RETRY; }
    }

    record PleaseRetryLimits(int attemptsLeft) implements ResponseMessage {
        public ResponseType type() { return ResponseType.PLEASE_RETRY_LIMITS; }
        public Map<String, String> placeholders() { return Map.of("#LEFT", Integer.toString(attemptsLeft)); }
    }

    record Incorrect() implements ResponseMessage {
        public ResponseType type() { return ResponseType.INCORRECT; }
    }

    record Correct(int score) implements ResponseMessage {
        public ResponseType type() { return ResponseType.CORRECT; }
        public Map<String, String> placeholders() { return Map.of("#SCORE", Integer.toString(score)); }
    }

    record GameComplete(int score) implements ResponseMessage {
        public ResponseType type() { return ResponseType.GAME_COMPLETE; }
        public Map<String, String> placeholders() { return Map.of("#SCORE", Integer.toString(score)); }
    }

    record ChooseNextTopic() implements ResponseMessage {
        public ResponseType type() { return ResponseType.CHOOSE_NEXT_TOPIC; }
    }

    record AlreadyAnswered() implements ResponseMessage {
        public ResponseType type() { return ResponseType.ALREADY_ANSWERED; }
    }

    record Quit() implements ResponseMessage {
        public ResponseType type() { return ResponseType.QUIT; }
    }
}
