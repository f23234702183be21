package com.meetpoll.exception;

import java.util.UUID;

public class UnknownSlotException extends NotFoundException {

    public UnknownSlotException(UUID slotId) {
        super("Time slot %s does not belong to this meeting", slotId);
    }
}
