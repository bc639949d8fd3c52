package com.herzen.quiz.api;

import com.herzen.quiz.dialog.SessionModels.GameSession;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.repository.SessionRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionRepository sessions;

    public SessionController(SessionRepository sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/{gameId}/{channelId}/{playerId}")
    public ResponseEntity<GameSession> session(@PathVariable int gameId,
                                               @PathVariable String channelId,
                                               @PathVariable String playerId) {
        return ResponseEntity.of(sessions.getById(gameId, new PlayerId(channelId, playerId)));
    }
}
