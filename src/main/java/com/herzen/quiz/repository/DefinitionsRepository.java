package com.herzen.quiz.repository;

import com.herzen.quiz.game.Game;
import com.herzen.quiz.game.GameModels.Channel;

import java.util.Optional;

public interface DefinitionsRepository {
    Optional<Game> getGameById(int gameId);

    Optional<Channel> getChannelById(String channelId);
}
