package com.meetpoll.exception;

public class StorageFailureException extends SchedulerException {

    public StorageFailureException(Throwable cause, String message, Object... args) {
        super(ErrorKind.INTERNAL, cause, message, args);
    }
}
