package com.herzen.quiz.response;

import com.herzen.quiz.response.ResponseMessage.*;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseTemplatesTest {
    private final ResponseTemplates templates = ResponseTemplates.defaults();

    @Test
    void substitutesPlaceholdersPerType() {
        assertEquals("Hello! Today we play #TEST_GAME. Want to join?", templates.format(new Greeting("#TEST_GAME")));
        assertTrue(templates.format(new Rules(List.of("topic1", "topic2"))).startsWith("Choose a topic from: topic1, topic2."));
        assertEquals("Next question: q11", templates.format(new AnswerQuestion("q11")));
        assertEquals("That is incorrect. Try again. 1 attempts left", templates.format(new PleaseRetryLimits(1)));
        assertEquals("That is correct. Your score: 3", templates.format(new Correct(3)));
        assertEquals("Game is complete. Your score: 7", templates.format(new GameComplete(7)));
        assertEquals("Ok... Goodbye!", templates.format(ResponseMessage.QUIT));
    }

    @Test
    void rejectsIncompleteTemplateSet() {
        Map<String, String> partial = new HashMap<>(templates.asMap());
        partial.remove("already_answered");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ResponseTemplates(partial));
        assertTrue(e.getMessage().contains("already_answered"));
    }

    @Test
    void rejectsUnknownTemplate() {
        Map<String, String> extra = new HashMap<>(templates.asMap());
        extra.put("farewell", "bye");
        assertThrows(IllegalArgumentException.class, () -> new ResponseTemplates(extra));
    }

    @Test
    void everyTypeHasADefaultTemplate() {
        for (ResponseType type : ResponseType.values()) {
            assertTrue(templates.asMap().containsKey(type.key()), type.name());
        }
    }
}
