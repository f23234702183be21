package com.meetpoll.exception;

import java.util.UUID;

public class AlreadyFinalizedException extends InvalidStateException {

    public AlreadyFinalizedException(UUID meetingId) {
        super("Meeting %s has already been finalized", meetingId);
    }
}
