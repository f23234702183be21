package com.meetpoll.service;

import com.meetpoll.domain.enums.Availability;
import com.meetpoll.domain.enums.MeetingStatus;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What a participant sees when opening a response link, including the answers they already gave.
 */
public record ParticipantView(
        UUID meetingId,
        String meetingTitle,
        String meetingDescription,
        MeetingStatus status,
        String finalizedSlot,
        String organizerEmail,
        String participantName,
        boolean responded,
        List<SlotView> slots,
        Map<UUID, Availability> answers,
        SuggestionView suggestion
) {
    public boolean acceptingResponses() {
        return status == MeetingStatus.SENT;
    }
}
