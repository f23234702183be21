package com.meetpoll.exception;

public class InvalidStateException extends SchedulerException {

    public InvalidStateException(String message, Object... args) {
        super(ErrorKind.INVALID_STATE, message, args);
    }

    public InvalidStateException(Throwable cause, String message, Object... args) {
        super(ErrorKind.INVALID_STATE, cause, message, args);
    }
}
