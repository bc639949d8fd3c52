package com.herzen.quiz.dialog;

import com.herzen.quiz.game.GameModels.QuestionId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class SessionModels {
    public record PlayerId(String channelId, String id) {
        public PlayerId {
            Objects.requireNonNull(channelId, "channelId");
            Objects.requireNonNull(id, "id");
        }
    }

    public record PlayerMessage(PlayerId playerId, String text) {}

    public record TopicResult(int topicId, int score) {}

    public enum Phase { NEW, DECIDING, CHOOSING_TOPIC, ANSWERING, COMPLETE, TERMINATED }

    // questionId and attempt are set only while ANSWERING
    public record SessionState(Phase phase, QuestionId questionId, int attempt) {
        public static final SessionState NEW = new SessionState(Phase.NEW, null, 0);
        public static final SessionState DECIDING = new SessionState(Phase.DECIDING, null, 0);
        public static final SessionState CHOOSING_TOPIC = new SessionState(Phase.CHOOSING_TOPIC, null, 0);
        public static final SessionState COMPLETE = new SessionState(Phase.COMPLETE, null, 0);
        public static final SessionState TERMINATED = new SessionState(Phase.TERMINATED, null, 0);

        public SessionState {
            Objects.requireNonNull(phase, "phase");
            if (phase == Phase.ANSWERING) {
                Objects.requireNonNull(questionId, "questionId is required while answering");
                if (attempt < 0) throw new IllegalArgumentException("attempt must not be negative: " + attempt);
            } else if (questionId != null || attempt != 0) {
                throw new IllegalArgumentException(phase + " carries no question");
            }
        }

        public static SessionState answering(QuestionId questionId, int attempt) {
            return new SessionState(Phase.ANSWERING, questionId, attempt);
        }

        public static SessionState of(Phase phase) {
            return switch (phase) {
                case NEW -> NEW;
                case DECIDING -> DECIDING;
                case CHOOSING_TOPIC -> CHOOSING_TOPIC;
                case COMPLETE -> COMPLETE;
                case TERMINATED -> TERMINATED;
                case ANSWERING -> throw new IllegalArgumentException("ANSWERING needs a question, use answering()");
            };
        }
    }

    public record GameSession(PlayerId playerId, int gameId, SessionState state, List<TopicResult> results, int score) {
        public GameSession {
            Objects.requireNonNull(playerId, "playerId");
            Objects.requireNonNull(state, "state");
            results = results == null ? List.of() : List.copyOf(results);
            int sum = results.stream().mapToInt(TopicResult::score).sum();
            if (sum != score) {
                throw new IllegalStateException("Session score " + score + " does not match results total " + sum);
            }
            if (results.stream().map(TopicResult::topicId).distinct().count() != results.size()) {
                throw new IllegalStateException("Session records a topic more than once: " + results);
            }
        }

        public static GameSession start(PlayerId playerId, int gameId) {
            return new GameSession(playerId, gameId, SessionState.NEW, List.of(), 0);
        }

        public GameSession withState(SessionState next) {
            return new GameSession(playerId, gameId, next, results, score);
        }

        public GameSession record(int topicId, int topicScore) {
            if (hasPlayed(topicId)) {
                throw new IllegalStateException("Topic " + topicId + " is already resolved for " + playerId);
            }
            List<TopicResult> next = new ArrayList<>(results);
            next.add(new TopicResult(topicId, topicScore));
            return new GameSession(playerId, gameId, state, next, score + topicScore);
        }

        public boolean hasPlayed(int topicId) {
            return results.stream().anyMatch(r -> r.topicId() == topicId);
        }

        public int resolvedTopics() {
            return results.size();
        }
    }
}
