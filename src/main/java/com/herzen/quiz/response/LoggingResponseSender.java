package com.herzen.quiz.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "quiz.delivery.sender", havingValue = "log", matchIfMissing = true)
public class LoggingResponseSender implements ResponseSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingResponseSender.class);

    @Override
    public void send(Response response) {
        log.info("[{}] -> {}: {}", response.channel().name(), response.to().id(), response.text());
    }
}
