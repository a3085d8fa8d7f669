package com.example.shadowlands.error;

/**
 * Raised by engine operations for caller errors. Never retried.
 * Anything thrown by the engine that is not an EngineException is a defect.
 */
public class EngineException extends RuntimeException {

    private final ErrorKind kind;

    public EngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public static EngineException of(ErrorKind kind, String format, Object... args) {
        return new EngineException(kind, String.format(format, args));
    }
}
