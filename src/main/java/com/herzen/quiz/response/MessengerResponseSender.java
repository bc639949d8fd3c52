package com.herzen.quiz.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.herzen.quiz.config.QuizProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
@ConditionalOnProperty(name = "quiz.delivery.sender", havingValue = "messenger")
public class MessengerResponseSender implements ResponseSender {
    private static final Logger log = LoggerFactory.getLogger(MessengerResponseSender.class);

    private final RestTemplate restTemplate;
    private final String apiUrl;

    public MessengerResponseSender(RestTemplateBuilder builder, QuizProperties properties) {
        this.restTemplate = builder.build();
        this.apiUrl = properties.messenger().apiUrl();
    }

    @Override
    public void send(Response response) {
        OutgoingMessage body = new OutgoingMessage("RESPONSE",
                new Recipient(response.to().id()),
                new Content(response.text()));
        restTemplate.postForObject(apiUrl + "/me/messages?access_token={token}", body, String.class,
                response.channel().token());
        log.debug("Sent {} to {}", response.message().type(), response.to());
    }

    public record OutgoingMessage(@JsonProperty("messaging_type") String messagingType,
                                  Recipient recipient,
                                  Content message) {}

    public record Recipient(String id) {}

    public record Content(String text) {}
}
