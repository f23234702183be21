package com.meetpoll.exception;

import java.util.UUID;

public class MeetingCancelledException extends InvalidStateException {

    public MeetingCancelledException(UUID meetingId) {
        super("Meeting %s has been cancelled", meetingId);
    }
}
