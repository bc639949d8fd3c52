package com.herzen.quiz.repository;

import com.herzen.quiz.config.QuizProperties;
import com.herzen.quiz.game.Game;
import com.herzen.quiz.game.GameDefinitionValidator;
import com.herzen.quiz.game.GameDefinitionValidator.DefinitionIssue;
import com.herzen.quiz.response.ResponseMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDefinitionsRepositoryTest {

    private static FileDefinitionsRepository load(String location) {
        QuizProperties properties = new QuizProperties(
                new QuizProperties.Definitions(location),
                new QuizProperties.Sessions("memory", 4),
                new QuizProperties.Delivery("sync", "log", 1),
                new QuizProperties.Messenger("http://localhost"),
                new QuizProperties.Webhook("TOKEN"),
                new QuizProperties.Console(false, "1", "console"));
        return new FileDefinitionsRepository(properties, new PathMatchingResourcePatternResolver(), new GameDefinitionValidator());
    }

    @Test
    void loadsGamesAndChannelsFromFixtures() {
        FileDefinitionsRepository repository = load("classpath:games");

        assertEquals(2, repository.games().size());
        Game game = repository.getGameById(1).orElseThrow();
        assertEquals("#TEST_GAME", game.name());
        assertEquals(2, game.maxAttempt());
        assertEquals(List.of("topic1", "topic2"), game.topicKeys());
        assertTrue(game.isYes("да"));

        assertEquals("test channel", repository.getChannelById("1").orElseThrow().name());
        assertTrue(repository.getChannelById("idle").orElseThrow().game().isEmpty());
        assertTrue(repository.getChannelById("missing").isEmpty());
        assertTrue(repository.getGameById(99).isEmpty());
    }

    @Test
    void appliesCustomVocabularyAndTemplates() {
        Game game = load("classpath:games/").getGameById(2).orElseThrow();

        assertTrue(game.isStop("хватит"));
        assertFalse(game.isStop("stop"));
        assertTrue(game.attemptLimit().isEmpty());
        assertEquals("Привет! Сегодня играем в История. Начнём?", game.format(new ResponseMessage.Greeting(game.name())));
        assertEquals("Неверно. Осталось попыток: 2", game.format(new ResponseMessage.PleaseRetryLimits(2)));
    }

    @Test
    void rejectsInvalidDefinitionsWithCodedIssues() {
        DefinitionLoadException e = assertThrows(DefinitionLoadException.class, () -> load("classpath:invalid"));
        List<String> codes = e.issues().stream().map(DefinitionIssue::code).toList();

        assertTrue(codes.contains("INVALID_MAX_ATTEMPT"));
        assertTrue(codes.contains("NEGATIVE_BONUS"));
        assertTrue(codes.contains("EMPTY_QUESTIONS"));
        assertTrue(codes.contains("GAME_NOT_FOUND"));
    }

    @Test
    void rejectsGameWithIncompleteTemplates() {
        DefinitionLoadException e = assertThrows(DefinitionLoadException.class, () -> load("classpath:incomplete"));
        assertTrue(e.getMessage().contains("game-3.json"));
    }

    @Test
    void failsWhenChannelsAreMissing() {
        assertThrows(DefinitionLoadException.class, () -> load("classpath:does-not-exist"));
    }

    @Test
    void loadsFromPlainDirectoryPath(@TempDir Path dataDir) throws IOException {
        copyFixtures(dataDir);

        FileDefinitionsRepository repository = load(dataDir.toAbsolutePath().toString());
        assertEquals(2, repository.games().size());
        assertEquals(1, repository.getChannelById("1").orElseThrow().gameId());
    }

    @Test
    void treatsUnqualifiedLocationsAsFilesystemPaths() {
        assertEquals("file:/srv/quiz/data", FileDefinitionsRepository.toLocation("/srv/quiz/data/"));
        assertEquals("file:./deploy/data", FileDefinitionsRepository.toLocation("./deploy/data"));
        assertEquals("file:C:/quiz/data", FileDefinitionsRepository.toLocation("C:/quiz/data"));
        assertEquals("classpath:games", FileDefinitionsRepository.toLocation("classpath:games/"));
        assertEquals("file:/srv/data", FileDefinitionsRepository.toLocation("file:/srv/data"));
    }

    static void copyFixtures(Path target) throws IOException {
        for (String name : List.of("channels.json", "game-1.json", "game-2.json")) {
            try (InputStream in = new ClassPathResource("games/" + name).getInputStream()) {
                Files.copy(in, target.resolve(name));
            }
        }
    }
}
