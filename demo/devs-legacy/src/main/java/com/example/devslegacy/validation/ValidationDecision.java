package com.example.devslegacy.validation;

public record ValidationDecision(Outcome outcome, String reason) {

    public enum Outcome {
        ALLOWED,
        FORBIDDEN,
        UNSUPPORTED_SCHEME
    }

    private static final ValidationDecision ALLOW = new ValidationDecision(Outcome.ALLOWED, null);

    public static ValidationDecision allow() {
        return ALLOW;
    }

    public static ValidationDecision forbidden(String reason) {
        return new ValidationDecision(Outcome.FORBIDDEN, reason);
    }

    public static ValidationDecision unsupportedScheme(String reason) {
        return new ValidationDecision(Outcome.UNSUPPORTED_SCHEME, reason);
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOWED;
    }
}
