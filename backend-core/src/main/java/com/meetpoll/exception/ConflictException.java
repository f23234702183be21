package com.meetpoll.exception;

public class ConflictException extends SchedulerException {

    public ConflictException(String message, Object... args) {
        super(ErrorKind.CONFLICT, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(ErrorKind.CONFLICT, cause, message, args);
    }
}
