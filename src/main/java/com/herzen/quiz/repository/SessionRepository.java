package com.herzen.quiz.repository;

import com.herzen.quiz.dialog.SessionModels.GameSession;
import com.herzen.quiz.dialog.SessionModels.PlayerId;

import java.util.Optional;

/**
 * Storage of conversation state keyed by (gameId, playerId). Callers serialize access per key.
 */
public interface SessionRepository {
    Optional<GameSession> getById(int gameId, PlayerId playerId);

    void store(GameSession session);
}
