package com.herzen.quiz.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class GameModels {
    public record Channel(String name,
                          @JsonProperty("channel_id") String channelId,
                          String token,
                          @JsonProperty("game_id") Integer gameId) {
        public Optional<Integer> game() {
            return Optional.ofNullable(gameId);
        }
    }

    public record Question(String text, List<String> answers) {
        public Question {
            answers = answers == null ? List.of() : List.copyOf(answers);
        }
    }

    public record Topic(String name, String key, List<Question> questions, int bonus) {
        public Topic {
            questions = questions == null ? List.of() : List.copyOf(questions);
        }
    }

    public record QuestionId(int topic, int question) {}

    public record GenericAnswers(Set<String> yes, Set<String> no, Set<String> stop) {
        public GenericAnswers {
            yes = yes == null ? Set.of("yes", "да") : Set.copyOf(yes);
            no = no == null ? Set.of("no", "нет") : Set.copyOf(no);
            stop = stop == null ? Set.of("stop", "стоп") : Set.copyOf(stop);
        }

        public static GenericAnswers defaults() {
            return new GenericAnswers(null, null, null);
        }
    }
}
