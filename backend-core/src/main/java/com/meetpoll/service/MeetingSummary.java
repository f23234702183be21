package com.meetpoll.service;

import com.meetpoll.domain.enums.MeetingStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MeetingSummary(
        UUID id,
        String title,
        String description,
        MeetingStatus status,
        String finalizedSlot,
        OffsetDateTime createdAt,
        int slotCount,
        int invited,
        int responded
) {
    public int pending() {
        return invited - responded;
    }
}
