package com.herzen.quiz.response;

public interface ResponseSender {
    void send(Response response);
}
