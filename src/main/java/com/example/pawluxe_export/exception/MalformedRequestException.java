package com.example.pawluxe_export.exception;

import java.util.List;

/**
 * Rejected submission; no job row was written.
 */
public class MalformedRequestException extends RuntimeException {
    private final List<String> violations;

    public MalformedRequestException(List<String> violations) {
        super("Malformed export request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public MalformedRequestException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
