package com.herzen.quiz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "quiz")
public record QuizProperties(@DefaultValue Definitions definitions,
                            @DefaultValue Sessions sessions,
                            @DefaultValue Delivery delivery,
                            @DefaultValue Messenger messenger,
                            @DefaultValue Webhook webhook,
                            @DefaultValue Console console) {

    // location: Spring resource location or plain directory holding channels.json and game-*.json
    public record Definitions(@DefaultValue("classpath:data") String location) {}

    public record Sessions(@DefaultValue("jdbc") String store,
                           @DefaultValue("64") int lockShards) {}

    // mode: sync | async, sender: log | messenger | console
    public record Delivery(@DefaultValue("sync") String mode,
                           @DefaultValue("log") String sender,
                           @DefaultValue("8") int workers) {}

    public record Messenger(@DefaultValue("https://graph.facebook.com/v12.0") String apiUrl) {}

    public record Webhook(@DefaultValue("MY_TEST_TOKEN") String verifyToken) {}

    public record Console(@DefaultValue("false") boolean enabled,
                          @DefaultValue("106197145160389") String channelId,
                          @DefaultValue("console") String playerId) {}
}
