package com.cvtailor.common.exception;

/**
 * Base class for every failure the orchestration core reports. The message is
 * human-readable and safe to show on a generation result.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorKind kind;

    protected OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
