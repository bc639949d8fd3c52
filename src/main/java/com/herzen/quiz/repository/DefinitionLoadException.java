package com.herzen.quiz.repository;

import com.herzen.quiz.game.GameDefinitionValidator.DefinitionIssue;

import java.util.List;

public class DefinitionLoadException extends RuntimeException {
    private final List<DefinitionIssue> issues;

    public DefinitionLoadException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of();
    }

    public DefinitionLoadException(String message, List<DefinitionIssue> issues) {
        super(message + ": " + issues);
        this.issues = List.copyOf(issues);
    }

    public List<DefinitionIssue> issues() {
        return issues;
    }
}
