package com.researchbot.core;

public class ResearchException extends RuntimeException {
    private final FailureKind kind;

    public ResearchException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public ResearchException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.RESEARCH_FAILED : kind;
    }

    public FailureKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind.name() + ": " + getMessage();
    }
}
