package com.meetpoll.service;

import java.util.List;

/**
 * Organizer dashboard for one meeting: who has answered, the slots ranked best first and
 * any alternative times participants proposed.
 */
public record MeetingOverview(
        MeetingSummary meeting,
        List<SlotView> slots,
        List<ParticipantStatus> participants,
        List<RankedSlot> ranking,
        List<SuggestionView> suggestions
) {
}
