package com.meetpoll.controller;

import com.meetpoll.exception.ErrorKind;
import com.meetpoll.exception.MeetingCancelledException;
import com.meetpoll.exception.TransientStorageException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void statusFor_shouldMapEveryErrorKind() {
        assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.INVALID_STATE));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.CONSTRAINT_VIOLATION));
        assertEquals(HttpStatus.FORBIDDEN, ApiExceptionHandler.statusFor(ErrorKind.FORBIDDEN));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(ErrorKind.INVALID_ARGUMENT));
        assertEquals(HttpStatus.UNAUTHORIZED, ApiExceptionHandler.statusFor(ErrorKind.UNAUTHORIZED));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusFor(ErrorKind.TRANSIENT));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ApiExceptionHandler.statusFor(ErrorKind.INTERNAL));
    }

    @Test
    void handleScheduler_shouldExposeKindAndMessage() {
        UUID meetingId = UUID.randomUUID();

        ResponseEntity<ApiExceptionHandler.ErrorResponse> response =
                handler.handleScheduler(new MeetingCancelledException(meetingId));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("INVALID_STATE", response.getBody().kind());
    }

    @Test
    void handleScheduler_shouldReportTransientFailureAsUnavailable() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> response = handler.handleScheduler(
                new TransientStorageException(new IllegalStateException("pool exhausted"), "Storage is busy"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("Storage is busy", response.getBody().message());
    }
}
