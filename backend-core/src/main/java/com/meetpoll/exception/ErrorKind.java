package com.meetpoll.exception;

public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    INVALID_STATE,
    FORBIDDEN,
    CONSTRAINT_VIOLATION,
    INVALID_ARGUMENT,
    UNAUTHORIZED,
    TRANSIENT,
    INTERNAL
}
