package com.herzen.quiz.dialog;

import com.herzen.quiz.dialog.SessionModels.GameSession;
import com.herzen.quiz.dialog.SessionModels.Phase;
import com.herzen.quiz.dialog.SessionModels.SessionState;
import com.herzen.quiz.game.Game;
import com.herzen.quiz.game.GameModels.QuestionId;
import com.herzen.quiz.response.ResponseMessage;
import com.herzen.quiz.response.ResponseMessage.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

@Component
public class DialogEngine {

    public StepResult step(GameSession session, Game game, String text) {
        if (session.state().phase() == Phase.TERMINATED) {
            return new StepResult(session, List.of(), false);
        }
        if (game.isStop(text)) {
            return new StepResult(session.withState(SessionState.TERMINATED), List.of(ResponseMessage.QUIT), true);
        }

        List<ResponseMessage> out = new ArrayList<>();
        GameSession next = switch (session.state().phase()) {
            case NEW -> greet(session, game, out);
            case DECIDING -> decide(session, game, text, out);
            case CHOOSING_TOPIC -> chooseTopic(session, game, text, out);
            case ANSWERING -> checkCompletion(answer(session, game, text, out), game, out);
            case COMPLETE -> {
                out.add(new GameComplete(session.score()));
                yield session;
            }
            case TERMINATED -> session;
        };
        return new StepResult(next, out, true);
    }

    private GameSession greet(GameSession session, Game game, List<ResponseMessage> out) {
        out.add(new Greeting(game.name()));
        return session.withState(SessionState.DECIDING);
    }

    private GameSession decide(GameSession session, Game game, String text, List<ResponseMessage> out) {
        if (game.isYes(text)) {
            out.add(new Rules(game.topicKeys()));
            return session.withState(SessionState.CHOOSING_TOPIC);
        }
        if (game.isNo(text)) {
            out.add(ResponseMessage.QUIT);
            return session.withState(SessionState.TERMINATED);
        }
        out.add(ResponseMessage.REPHRASE);
        return session;
    }

    private GameSession chooseTopic(GameSession session, Game game, String text, List<ResponseMessage> out) {
        Optional<Integer> topic = game.findTopic(text);
        if (topic.isEmpty()) {
            out.add(ResponseMessage.REPHRASE);
            return session;
        }
        if (session.hasPlayed(topic.get())) {
            out.add(ResponseMessage.ALREADY_ANSWERED);
            return session;
        }
        QuestionId questionId = game.selectQuestion(topic.get());
        out.add(new AnswerQuestion(game.questionText(questionId)));
        return session.withState(SessionState.answering(questionId, 0));
    }

    private GameSession answer(GameSession session, Game game, String text, List<ResponseMessage> out) {
        QuestionId questionId = session.state().questionId();
        int topic = questionId.topic();
        if (game.isCorrectAnswer(questionId, text)) {
            GameSession next = session.record(topic, game.bonus(topic)).withState(SessionState.CHOOSING_TOPIC);
            out.add(new Correct(next.score()));
            return next;
        }

        OptionalInt limit = game.attemptLimit();
        if (limit.isEmpty()) {
            out.add(ResponseMessage.PLEASE_RETRY);
            return session;
        }
        int nextAttempt = session.state().attempt() + 1;
        if (nextAttempt >= limit.getAsInt()) {
            out.add(ResponseMessage.INCORRECT);
            return session.record(topic, 0).withState(SessionState.CHOOSING_TOPIC);
        }
        out.add(new PleaseRetryLimits(limit.getAsInt() - nextAttempt));
        return session.withState(SessionState.answering(questionId, nextAttempt));
    }

    // Runs after every answer; completion takes precedence over asking for the next topic.
    private GameSession checkCompletion(GameSession session, Game game, List<ResponseMessage> out) {
        if (game.isComplete(session.resolvedTopics())) {
            out.add(new GameComplete(session.score()));
            return session.withState(SessionState.COMPLETE);
        }
        if (session.state().phase() == Phase.CHOOSING_TOPIC) {
            out.add(ResponseMessage.CHOOSE_NEXT_TOPIC);
        }
        return session;
    }

    /**
     * @param persist false when the input was ignored and the stored session need not be rewritten
     */
    public record StepResult(GameSession session, List<ResponseMessage> responses, boolean persist) {
        public StepResult {
            responses = List.copyOf(responses);
        }
    }
}
