package com.herzen.quiz.response;

import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.game.GameModels.Channel;

public record Response(PlayerId to, Channel channel, ResponseMessage message, ResponseFormatter formatter) {
    public String text() {
        return formatter.format(message);
    }
}
