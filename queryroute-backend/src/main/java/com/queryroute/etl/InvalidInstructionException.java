package com.queryroute.etl;

import java.util.List;

/**
 * Thrown when ETL instructions reference fields the source does not have, or are structurally incomplete.
 */
public class InvalidInstructionException extends RuntimeException {
    private final List<String> problems;

    public InvalidInstructionException(String message) {
        this(message, List.of());
    }

    public InvalidInstructionException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
