package com.meetpoll.notification;

import java.util.List;

/**
 * Structured data handed to the {@link Notifier}; rendering and transport are the notifier's business.
 *
 * @param participantName name of the invited participant (for organizer notices: who responded)
 * @param link            response URL for participants, dashboard URL for the organizer
 * @param slots           rendered slot labels; for a finalization notice the single chosen slot
 */
public record NotificationPayload(
        String participantName,
        String meetingTitle,
        String meetingDescription,
        String organizerEmail,
        List<String> slots,
        String link
) {
    public NotificationPayload {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }
}
