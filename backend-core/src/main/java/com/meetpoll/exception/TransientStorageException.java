package com.meetpoll.exception;

/**
 * Storage did not answer in time or refused a lock. The operation may be retried by the caller.
 */
public class TransientStorageException extends SchedulerException {

    public TransientStorageException(Throwable cause, String message, Object... args) {
        super(ErrorKind.TRANSIENT, cause, message, args);
    }
}
