package com.herzen.quiz.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.quiz.config.QuizProperties;
import com.herzen.quiz.dialog.SessionModels.PlayerMessage;
import com.herzen.quiz.service.QuizMessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/webhook")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final QuizMessageService messageService;
    private final MessengerPayloadParser parser;
    private final String verifyToken;

    public WebhookController(QuizMessageService messageService,
                             MessengerPayloadParser parser,
                             QuizProperties properties) {
        this.messageService = messageService;
        this.parser = parser;
        this.verifyToken = properties.webhook().verifyToken();
    }

    @GetMapping
    public ResponseEntity<String> subscribe(@RequestParam(name = "hub.mode", required = false) String mode,
                                            @RequestParam(name = "hub.verify_token", required = false) String token,
                                            @RequestParam(name = "hub.challenge", required = false) String challenge) {
        if ("subscribe".equals(mode) && verifyToken.equals(token)) {
            log.info("Webhook subscription confirmed");
            return ResponseEntity.ok(challenge == null ? "" : challenge);
        }
        log.warn("Rejected webhook subscription, mode={}", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    @PostMapping
    public ResponseEntity<Void> event(@RequestBody JsonNode payload) {
        List<PlayerMessage> messages = parser.parse(payload);
        log.debug("Webhook push with {} text messages", messages.size());
        for (PlayerMessage message : messages) {
            try {
                messageService.process(message);
            } catch (RuntimeException e) {
                log.error("Failed to process message from {}", message.playerId(), e);
            }
        }
        return ResponseEntity.ok().build();
    }
}
