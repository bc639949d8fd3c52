package com.herzen.quiz.service;

import com.herzen.quiz.dialog.DialogEngine;
import com.herzen.quiz.dialog.SessionModels.GameSession;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.dialog.SessionModels.PlayerMessage;
import com.herzen.quiz.game.Game;
import com.herzen.quiz.game.GameModels.Channel;
import com.herzen.quiz.repository.DefinitionsRepository;
import com.herzen.quiz.repository.SessionRepository;
import com.herzen.quiz.response.Response;
import com.herzen.quiz.response.ResponseDispatcher;
import com.herzen.quiz.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class QuizMessageService {
    private static final Logger log = LoggerFactory.getLogger(QuizMessageService.class);

    private final DefinitionsRepository definitions;
    private final SessionRepository sessions;
    private final DialogEngine engine;
    private final ResponseDispatcher dispatcher;
    private final SessionLocks locks;

    public QuizMessageService(DefinitionsRepository definitions,
                              SessionRepository sessions,
                              DialogEngine engine,
                              ResponseDispatcher dispatcher,
                              SessionLocks locks) {
        this.definitions = definitions;
        this.sessions = sessions;
        this.engine = engine;
        this.dispatcher = dispatcher;
        this.locks = locks;
    }

    public void process(PlayerMessage message) {
        PlayerId playerId = message.playerId();
        Optional<Channel> channel = definitions.getChannelById(playerId.channelId());
        if (channel.isEmpty()) {
            log.debug("Ignoring message from {}: no channel config", playerId.channelId());
            return;
        }
        Optional<Integer> gameId = channel.get().game();
        if (gameId.isEmpty()) {
            log.debug("Ignoring message from {}: no games configured for channel", playerId.channelId());
            return;
        }
        Optional<Game> game = definitions.getGameById(gameId.get());
        if (game.isEmpty()) {
            log.debug("Ignoring message from {}: game {} not found", playerId.channelId(), gameId.get());
            return;
        }
        play(channel.get(), game.get(), playerId, TextNormalizer.normalize(message.text()));
    }

    private void play(Channel channel, Game game, PlayerId playerId, String text) {
        ReentrantLock lock = locks.lockFor(game.id(), playerId);
        lock.lock();
        try {
            GameSession session = sessions.getById(game.id(), playerId)
                    .orElseGet(() -> GameSession.start(playerId, game.id()));
            DialogEngine.StepResult step = engine.step(session, game, text);
            if (!step.persist()) {
                log.debug("Session of {} in game {} is terminated, ignoring input", playerId, game.id());
                return;
            }
            sessions.store(step.session());
            log.debug("Player {} in game {}: {} -> {}", playerId, game.id(),
                    session.state().phase(), step.session().state().phase());

            List<Response> responses = step.responses().stream()
                    .map(m -> new Response(playerId, channel, m, game))
                    .toList();
            dispatcher.dispatch(responses);
        } finally {
            lock.unlock();
        }
    }
}
