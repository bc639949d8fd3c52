package com.herzen.quiz.api;

import com.herzen.quiz.RecordingResponseSender;
import com.herzen.quiz.TestQuizConfig;
import com.herzen.quiz.dialog.SessionModels.PlayerId;
import com.herzen.quiz.response.ResponseMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestQuizConfig.class)
class WebhookControllerTest {
    @Autowired
    private MockMvc mvc;

    @Autowired
    private RecordingResponseSender sender;

    private static String push(String channelId, String playerId, String text) {
        return """
                {"object": "page", "entry": [{"id": "%1$s", "messaging": [
                  {"sender": {"id": "%2$s"}, "recipient": {"id": "%1$s"}, "message": {"mid": "m", "text": "%3$s"}}
                ]}]}
                """.formatted(channelId, playerId, text);
    }

    @Test
    void subscribeRequestReceivesChallenge() throws Exception {
        mvc.perform(get("/api/webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.challenge", "1492553178")
                        .param("hub.verify_token", "TOKEN"))
                .andExpect(status().isOk())
                .andExpect(content().string("1492553178"));
    }

    @Test
    void subscribeWithWrongTokenIsForbidden() throws Exception {
        mvc.perform(get("/api/webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.challenge", "1")
                        .param("hub.verify_token", "WRONG"))
                .andExpect(status().isForbidden());
    }

    @Test
    void eventPushIsAcknowledgedAndPlayed() throws Exception {
        mvc.perform(post("/api/webhook").contentType(MediaType.APPLICATION_JSON).content(push("1", "webhook-player", "hello")))
                .andExpect(status().isOk());
        mvc.perform(post("/api/webhook").contentType(MediaType.APPLICATION_JSON).content(push("1", "webhook-player", "yes")))
                .andExpect(status().isOk());

        assertEquals(List.of(
                        new ResponseMessage.Greeting("#TEST_GAME"),
                        new ResponseMessage.Rules(List.of("topic1", "topic2"))),
                sender.messagesFor(new PlayerId("1", "webhook-player")));
    }

    @Test
    void pushForUnknownChannelIsStillAcknowledged() throws Exception {
        mvc.perform(post("/api/webhook").contentType(MediaType.APPLICATION_JSON).content(push("nobody", "p", "hello")))
                .andExpect(status().isOk());
        assertEquals(List.of(), sender.messagesFor(new PlayerId("nobody", "p")));
    }

    @Test
    void exposesStoredSession() throws Exception {
        mvc.perform(post("/api/webhook").contentType(MediaType.APPLICATION_JSON).content(push("1", "inspected", "hi")))
                .andExpect(status().isOk());

        mvc.perform(get("/api/sessions/1/1/inspected"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.phase").value("DECIDING"))
                .andExpect(jsonPath("$.score").value(0));
        mvc.perform(get("/api/sessions/1/1/never-seen"))
                .andExpect(status().isNotFound());
    }
}
