package com.meetpoll.service;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ParticipantStatus(
        UUID contactId,
        String name,
        String email,
        boolean responded,
        OffsetDateTime respondedAt,
        String responseLink
) {
}
