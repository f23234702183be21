package com.meetpoll.exception;

public class NotFoundException extends SchedulerException {

    public NotFoundException(String message, Object... args) {
        super(ErrorKind.NOT_FOUND, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(ErrorKind.NOT_FOUND, cause, message, args);
    }
}
