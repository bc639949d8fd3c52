package com.herzen.quiz.console;

import com.herzen.quiz.config.QuizProperties;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.dialog.SessionModels.PlayerMessage;
import com.herzen.quiz.service.QuizMessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Plays the quiz from standard input as a single player of the configured console channel.
 * Every line is one message; {@code :q} or end of input stops the loop.
 */
@Component
@ConditionalOnProperty(name = "quiz.console.enabled", havingValue = "true")
public class QuizConsoleRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(QuizConsoleRunner.class);
    static final String QUIT_COMMAND = ":q";

    private final QuizMessageService messageService;
    private final PlayerId player;

    public QuizConsoleRunner(QuizMessageService messageService, QuizProperties properties) {
        this.messageService = messageService;
        this.player = new PlayerId(properties.console().channelId(), properties.console().playerId());
    }

    @Override
    public void run(String... args) throws IOException {
        play(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public void play(BufferedReader in) throws IOException {
        log.info("Console session started for {}, type {} to exit", player, QUIT_COMMAND);
        String line;
        while ((line = in.readLine()) != null) {
            if (QUIT_COMMAND.equals(line.trim())) break;
            messageService.process(new PlayerMessage(player, line));
        }
        log.info("Console session finished");
    }
}
