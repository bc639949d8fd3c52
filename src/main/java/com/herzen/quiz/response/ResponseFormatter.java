package com.herzen.quiz.response;

@FunctionalInterface
public interface ResponseFormatter {
    String format(ResponseMessage message);
}
