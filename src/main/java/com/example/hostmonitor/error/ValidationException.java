package com.example.hostmonitor.error;

import java.util.List;

/**
 * A rule definition or incident action was rejected before being applied.
 */
public class ValidationException extends RuntimeException {

    private final List<String> problems;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
