package com.meetpoll.exception;

import java.util.UUID;

public class MeetingFinalizedException extends InvalidStateException {

    public MeetingFinalizedException(UUID meetingId) {
        super("Meeting %s is already scheduled and no longer accepts responses", meetingId);
    }
}
