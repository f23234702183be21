package com.meetpoll.context;

import com.meetpoll.util.EmailAddresses;

import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated organizer on whose behalf a core operation runs. Built once per request by
 * the web layer and passed explicitly into every organizer-facing service method.
 */
public record OrganizerContext(UUID organizerId, String email) {

    public OrganizerContext {
        Objects.requireNonNull(organizerId, "organizerId");
        email = EmailAddresses.canonical(email);
        if (email == null || email.isEmpty()) {
            throw new IllegalArgumentException("email is required");
        }
    }
}
