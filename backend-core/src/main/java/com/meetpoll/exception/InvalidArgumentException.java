package com.meetpoll.exception;

public class InvalidArgumentException extends SchedulerException {

    public InvalidArgumentException(String message, Object... args) {
        super(ErrorKind.INVALID_ARGUMENT, message, args);
    }

    public InvalidArgumentException(Throwable cause, String message, Object... args) {
        super(ErrorKind.INVALID_ARGUMENT, cause, message, args);
    }
}
