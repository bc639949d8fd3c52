package com.herzen.quiz.console;

import com.herzen.quiz.response.Response;
import com.herzen.quiz.response.ResponseSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

@Component
@ConditionalOnProperty(name = "quiz.delivery.sender", havingValue = "console")
public class ConsoleResponseSender implements ResponseSender {
    private final PrintStream out;

    public ConsoleResponseSender() {
        this(System.out);
    }

    public ConsoleResponseSender(PrintStream out) {
        this.out = out;
    }

    @Override
    public void send(Response response) {
        out.println(response.text());
        out.flush();
    }
}
