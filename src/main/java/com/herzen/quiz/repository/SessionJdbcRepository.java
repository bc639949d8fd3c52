package com.herzen.quiz.repository;

import com.herzen.quiz.dialog.SessionModels.*;
import com.herzen.quiz.game.GameModels.QuestionId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "quiz.sessions.store", havingValue = "jdbc", matchIfMissing = true)
public class SessionJdbcRepository implements SessionRepository {
    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<GameSession> getById(int gameId, PlayerId playerId) {
        List<SessionRow> rows = jdbcTemplate.query(
                "SELECT phase, topic_index, question_index, attempt, score FROM game_sessions WHERE game_id=? AND channel_id=? AND player_id=?",
                (rs, n) -> new SessionRow(Phase.valueOf(rs.getString(1)),
                        (Integer) rs.getObject(2), (Integer) rs.getObject(3), rs.getInt(4), rs.getInt(5)),
                gameId, playerId.channelId(), playerId.id());
        if (rows.isEmpty()) return Optional.empty();

        List<TopicResult> results = jdbcTemplate.query(
                "SELECT topic_id, score FROM session_results WHERE game_id=? AND channel_id=? AND player_id=? ORDER BY position",
                (rs, n) -> new TopicResult(rs.getInt(1), rs.getInt(2)),
                gameId, playerId.channelId(), playerId.id());

        SessionRow row = rows.get(0);
        return Optional.of(new GameSession(playerId, gameId, row.toState(), results, row.score()));
    }

    @Override
    @Transactional
    public void store(GameSession session) {
        PlayerId p = session.playerId();
        QuestionId q = session.state().questionId();
        jdbcTemplate.update(
                "MERGE INTO game_sessions(game_id, channel_id, player_id, phase, topic_index, question_index, attempt, score) KEY(game_id, channel_id, player_id) VALUES (?,?,?,?,?,?,?,?)",
                session.gameId(), p.channelId(), p.id(), session.state().phase().name(),
                q == null ? null : q.topic(), q == null ? null : q.question(),
                session.state().attempt(), session.score());

        List<TopicResult> results = session.results();
        for (int i = 0; i < results.size(); i++) {
            TopicResult r = results.get(i);
            jdbcTemplate.update(
                    "MERGE INTO session_results(game_id, channel_id, player_id, topic_id, position, score) KEY(game_id, channel_id, player_id, topic_id) VALUES (?,?,?,?,?,?)",
                    session.gameId(), p.channelId(), p.id(), r.topicId(), i, r.score());
        }
    }

    private record SessionRow(Phase phase, Integer topicIndex, Integer questionIndex, int attempt, int score) {
        SessionState toState() {
            if (phase == Phase.ANSWERING) {
                return SessionState.answering(new QuestionId(topicIndex, questionIndex), attempt);
            }
            return SessionState.of(phase);
        }
    }
}
