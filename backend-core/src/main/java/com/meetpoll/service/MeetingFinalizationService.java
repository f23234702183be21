package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.TimeSlot;
import com.meetpoll.exception.AlreadyFinalizedException;
import com.meetpoll.exception.InvalidStateException;
import com.meetpoll.exception.MeetingCancelledException;
import com.meetpoll.exception.UnknownSlotException;
import com.meetpoll.notification.DispatchReport;
import com.meetpoll.notification.Envelope;
import com.meetpoll.repository.MeetingRepository;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.repository.TimeSlotRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.SlotFormats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Picks the final slot of a sent meeting. Exactly one of any number of concurrent calls succeeds;
 * the rest see {@link AlreadyFinalizedException}. Participants are told after the commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingFinalizationService {

    private final MeetingRepository meetingRepository;
    private final TimeSlotRepository slotRepository;
    private final ParticipantBindingRepository bindingRepository;
    private final MeetingLookup meetingLookup;
    private final NotificationService notificationService;
    private final MeetPollProperties properties;
    private final StorageTransactions storage;

    public FinalizationResult finalizeMeeting(OrganizerContext ctx, UUID meetingId, UUID slotId) {
        FinalizationPlan plan = storage.write(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireFinalizable(meeting.getStatus(), meetingId);
            TimeSlot slot = slotRepository.findByIdAndMeeting_Id(slotId, meetingId)
                    .orElseThrow(() -> new UnknownSlotException(slotId));
            String rendered = SlotFormats.longForm(slot.getStartsAt(), properties.safeZone());
            String label = SlotFormats.withDuration(slot.getStartsAt(), slot.getDurationMinutes(), properties.safeZone());

            if (meetingRepository.finalizeIfSent(meetingId, rendered) == 0) {
                Meeting current = meetingLookup.requireOwned(ctx, meetingId);
                requireFinalizable(current.getStatus(), meetingId);
                throw new AlreadyFinalizedException(meetingId);
            }

            List<Envelope> envelopes = bindingRepository.findByMeeting_IdOrderByContact_NameAsc(meetingId).stream()
                    .map(b -> notificationService.participantEnvelope(b, meeting, ctx.email(), List.of(label)))
                    .toList();
            return new FinalizationPlan(rendered, envelopes);
        });

        DispatchReport report = notificationService.dispatch(NotificationKind.FINALIZED, plan.envelopes());
        log.info("Finalized meeting {} at {}", meetingId, plan.rendered());
        return new FinalizationResult(meetingId, slotId, plan.rendered(), report);
    }

    private static void requireFinalizable(MeetingStatus status, UUID meetingId) {
        if (status == MeetingStatus.FINALIZED) {
            throw new AlreadyFinalizedException(meetingId);
        }
        if (status == MeetingStatus.CANCELLED) {
            throw new MeetingCancelledException(meetingId);
        }
        if (status != MeetingStatus.SENT) {
            throw new InvalidStateException("Meeting %s has not been sent yet", meetingId);
        }
    }

    private record FinalizationPlan(String rendered, List<Envelope> envelopes) {
    }

    public record FinalizationResult(UUID meetingId, UUID slotId, String finalizedSlot, DispatchReport dispatch) {
    }
}
