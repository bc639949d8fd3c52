package com.herzen.quiz.service;

import com.herzen.quiz.config.QuizProperties;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

@Component
public class SessionLocks {
    private final ReentrantLock[] shards;

    public SessionLocks(QuizProperties properties) {
        int count = Math.max(1, properties.sessions().lockShards());
        this.shards = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            shards[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(int gameId, PlayerId playerId) {
        return shards[Math.floorMod(Objects.hash(gameId, playerId), shards.length)];
    }

    public int shardCount() {
        return shards.length;
    }
}
