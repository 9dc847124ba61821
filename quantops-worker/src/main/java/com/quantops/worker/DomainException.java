package com.quantops.worker;

/**
 * Exception thrown by operation functions on a domain failure.
 * The message is recorded verbatim as the operation's error message.
 */
public class DomainException extends Exception {

    private final ErrorKind kind;

    public DomainException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DomainException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static DomainException invalidRequest(String message) {
        return new DomainException(ErrorKind.INVALID_REQUEST, message);
    }

    public static DomainException internal(String message, Throwable cause) {
        return new DomainException(ErrorKind.INTERNAL, message, cause);
    }
}
