package com.meetpoll.exception;

/**
 * Root of every error raised by the scheduling core. Callers branch on {@link #getKind()};
 * storage-level exceptions are translated into one of these before leaving a service.
 */
public abstract class SchedulerException extends RuntimeException {

    private final ErrorKind kind;

    protected SchedulerException(ErrorKind kind, String message, Object... args) {
        super(format(message, args));
        this.kind = kind;
    }

    protected SchedulerException(ErrorKind kind, Throwable cause, String message, Object... args) {
        super(format(message, args), cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == ErrorKind.TRANSIENT;
    }

    private static String format(String message, Object... args) {
        if (message == null || args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
