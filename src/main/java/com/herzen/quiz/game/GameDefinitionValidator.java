package com.herzen.quiz.game;

import com.herzen.quiz.game.GameModels.Channel;
import com.herzen.quiz.game.GameModels.Question;
import com.herzen.quiz.game.GameModels.Topic;
import com.herzen.quiz.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class GameDefinitionValidator {
    private static final Logger log = LoggerFactory.getLogger(GameDefinitionValidator.class);

    public List<DefinitionIssue> validate(List<Game> games, List<Channel> channels) {
        List<DefinitionIssue> issues = new ArrayList<>();

        duplicate(games, g -> String.valueOf(g.id()), "DUPLICATE_GAME", "game", issues);
        duplicate(channels, Channel::channelId, "DUPLICATE_CHANNEL", "channel", issues);

        games.forEach(g -> validateGame(g, issues));

        Set<Integer> gameIds = games.stream().map(Game::id).collect(Collectors.toSet());
        channels.forEach(c -> {
            if (c.channelId() == null || c.channelId().isBlank()) {
                issues.add(new DefinitionIssue("MISSING_FIELD", "Channel " + c.name() + " has no channel_id", "channel"));
            }
            if (c.gameId() != null && !gameIds.contains(c.gameId())) {
                issues.add(new DefinitionIssue("GAME_NOT_FOUND", "Channel references unknown game: " + c.gameId(), c.channelId()));
            }
        });

        return issues;
    }

    private void validateGame(Game game, List<DefinitionIssue> issues) {
        String node = "game-" + game.id();
        if (game.name() == null || game.name().isBlank()) {
            issues.add(new DefinitionIssue("MISSING_FIELD", "Game has no name", node));
        }
        if (game.topics().isEmpty()) {
            issues.add(new DefinitionIssue("EMPTY_TOPICS", "Game has no topics", node));
        }
        if (game.maxAttempt() != null && game.maxAttempt() < 1) {
            issues.add(new DefinitionIssue("INVALID_MAX_ATTEMPT", "max_attempt must be at least 1, got " + game.maxAttempt(), node));
        }

        for (int t = 0; t < game.topics().size(); t++) {
            Topic topic = game.topics().get(t);
            String topicNode = node + "/topic-" + t;
            if (topic.key() == null || topic.key().isEmpty()) {
                issues.add(new DefinitionIssue("MISSING_FIELD", "Topic has no key", topicNode));
            }
            if (topic.bonus() < 0) {
                issues.add(new DefinitionIssue("NEGATIVE_BONUS", "Topic bonus is negative: " + topic.bonus(), topicNode));
            }
            if (topic.questions().isEmpty()) {
                issues.add(new DefinitionIssue("EMPTY_QUESTIONS", "Topic " + topic.key() + " has no questions", topicNode));
            }
            for (int q = 0; q < topic.questions().size(); q++) {
                Question question = topic.questions().get(q);
                if (question.answers().isEmpty()) {
                    issues.add(new DefinitionIssue("EMPTY_ANSWERS", "Question has no accepted answers: " + question.text(), topicNode + "/question-" + q));
                }
            }
        }

        warnNonCanonical(game, node);
    }

    // Such entries load fine but can never equal normalized input.
    private void warnNonCanonical(Game game, String node) {
        Stream<String> vocabulary = Stream.of(
                game.genericAnswers().yes().stream(),
                game.genericAnswers().no().stream(),
                game.genericAnswers().stop().stream(),
                game.topics().stream().map(Topic::key).filter(Objects::nonNull),
                game.topics().stream().flatMap(t -> t.questions().stream()).flatMap(q -> q.answers().stream())
        ).flatMap(Function.identity());

        vocabulary.filter(v -> !TextNormalizer.isCanonical(v))
                .forEach(v -> log.warn("{}: '{}' is not in canonical form and will never match player input", node, v));
    }

    private <T> void duplicate(List<T> rows, Function<T, String> id, String code, String block, List<DefinitionIssue> issues) {
        Map<String, Long> counts = rows.stream()
                .map(id)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(v -> v, Collectors.counting()));
        counts.forEach((key, count) -> {
            if (count > 1) {
                issues.add(new DefinitionIssue(code, "Duplicate " + block + " id: " + key, key));
            }
        });
    }

    public record DefinitionIssue(String code, String message, String node) {}
}
