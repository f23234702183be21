package com.meetpoll.exception;

public class ForbiddenException extends SchedulerException {

    public ForbiddenException(String message, Object... args) {
        super(ErrorKind.FORBIDDEN, message, args);
    }

    public ForbiddenException(Throwable cause, String message, Object... args) {
        super(ErrorKind.FORBIDDEN, cause, message, args);
    }
}
