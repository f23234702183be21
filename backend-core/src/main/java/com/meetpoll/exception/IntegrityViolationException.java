package com.meetpoll.exception;

/**
 * A referential constraint blocked the change, e.g. deleting a row that others still point at.
 */
public class IntegrityViolationException extends SchedulerException {

    public IntegrityViolationException(String message, Object... args) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message, args);
    }

    public IntegrityViolationException(Throwable cause, String message, Object... args) {
        super(ErrorKind.CONSTRAINT_VIOLATION, cause, message, args);
    }
}
