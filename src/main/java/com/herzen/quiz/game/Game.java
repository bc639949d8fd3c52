package com.herzen.quiz.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.herzen.quiz.game.GameModels.GenericAnswers;
import com.herzen.quiz.game.GameModels.Question;
import com.herzen.quiz.game.GameModels.QuestionId;
import com.herzen.quiz.game.GameModels.Topic;
import com.herzen.quiz.response.ResponseFormatter;
import com.herzen.quiz.response.ResponseMessage;
import com.herzen.quiz.response.ResponseTemplates;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

public record Game(int id,
                   String name,
                   List<Topic> topics,
                   @JsonProperty("max_attempt") Integer maxAttempt,
                   @JsonProperty("generic_answers") GenericAnswers genericAnswers,
                   ResponseTemplates responses) implements ResponseFormatter {

    public Game {
        topics = topics == null ? List.of() : List.copyOf(topics);
        genericAnswers = genericAnswers == null ? GenericAnswers.defaults() : genericAnswers;
        responses = responses == null ? ResponseTemplates.defaults() : responses;
    }

    public boolean isYes(String text) {
        return genericAnswers.yes().contains(text);
    }

    public boolean isNo(String text) {
        return genericAnswers.no().contains(text);
    }

    public boolean isStop(String text) {
        return genericAnswers.stop().contains(text);
    }

    public Optional<Integer> findTopic(String text) {
        return IntStream.range(0, topics.size())
                .filter(i -> topics.get(i).key().contains(text))
                .boxed()
                .findFirst();
    }

    public QuestionId selectQuestion(int topicId) {
        int count = topic(topicId).questions().size();
        return new QuestionId(topicId, ThreadLocalRandom.current().nextInt(count));
    }

    public String questionText(QuestionId questionId) {
        return question(questionId).text();
    }

    public boolean isCorrectAnswer(QuestionId questionId, String text) {
        return question(questionId).answers().contains(text);
    }

    public int bonus(int topicId) {
        return topic(topicId).bonus();
    }

    public boolean isComplete(int resolvedTopics) {
        return resolvedTopics == topics.size();
    }

    public List<String> topicKeys() {
        return topics.stream().map(Topic::key).toList();
    }

    public OptionalInt attemptLimit() {
        return maxAttempt == null ? OptionalInt.empty() : OptionalInt.of(maxAttempt);
    }

    @Override
    public String format(ResponseMessage message) {
        return responses.format(message);
    }

    private Topic topic(int topicId) {
        if (topicId < 0 || topicId >= topics.size()) {
            throw new IllegalArgumentException("Topic " + topicId + " does not exist in game " + id);
        }
        return topics.get(topicId);
    }

    private Question question(QuestionId questionId) {
        List<Question> questions = topic(questionId.topic()).questions();
        if (questionId.question() < 0 || questionId.question() >= questions.size()) {
            throw new IllegalArgumentException("Question " + questionId + " does not exist in game " + id);
        }
        return questions.get(questionId.question());
    }
}
