package com.meetpoll.exception;

public class InvalidTokenException extends NotFoundException {

    public InvalidTokenException() {
        super("Invalid or expired response link");
    }
}
