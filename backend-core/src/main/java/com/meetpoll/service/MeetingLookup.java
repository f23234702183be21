package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.repository.MeetingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Loads meetings on behalf of their organizer. Another organizer's meeting is reported as
 * missing. Joins the caller's transaction.
 */
@Component
@RequiredArgsConstructor
class MeetingLookup {

    private final MeetingRepository meetingRepository;

    Meeting requireOwned(OrganizerContext ctx, UUID meetingId) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() -> new NotFoundException("Meeting %s not found", meetingId));
        if (!meeting.getOrganizer().getId().equals(ctx.organizerId())) {
            throw new NotFoundException("Meeting %s not found", meetingId);
        }
        return meeting;
    }
}
