package com.meetpoll.exception;

import java.util.UUID;

public class ContactInUseException extends IntegrityViolationException {

    public ContactInUseException(UUID contactId) {
        super("Contact %s is still invited to at least one meeting", contactId);
    }

    public ContactInUseException(Throwable cause) {
        super(cause, "Contact is still invited to at least one meeting");
    }
}
