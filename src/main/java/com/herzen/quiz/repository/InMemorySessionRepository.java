package com.herzen.quiz.repository;

import com.herzen.quiz.dialog.SessionModels.GameSession;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "quiz.sessions.store", havingValue = "memory")
public class InMemorySessionRepository implements SessionRepository {
    private final Map<SessionKey, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<GameSession> getById(int gameId, PlayerId playerId) {
        return Optional.ofNullable(sessions.get(new SessionKey(gameId, playerId)));
    }

    @Override
    public void store(GameSession session) {
        sessions.put(new SessionKey(session.gameId(), session.playerId()), session);
    }

    public int size() {
        return sessions.size();
    }

    private record SessionKey(int gameId, PlayerId playerId) {}
}
