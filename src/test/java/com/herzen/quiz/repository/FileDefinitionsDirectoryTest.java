package com.herzen.quiz.repository;

import com.herzen.quiz.game.Game;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
class FileDefinitionsDirectoryTest {
    @TempDir
    static Path dataDir;

    @Autowired
    private DefinitionsRepository definitions;

    @DynamicPropertySource
    static void dataDirectory(DynamicPropertyRegistry registry) {
        try {
            FileDefinitionsRepositoryTest.copyFixtures(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("quiz.definitions.location", () -> dataDir.toAbsolutePath().toString());
    }

    @Test
    void webContextLoadsDefinitionsFromPlainDirectory() {
        Game game = definitions.getGameById(2).orElseThrow();
        assertEquals("История", game.name());
        assertEquals(2, definitions.getChannelById("2").orElseThrow().gameId());
    }
}
