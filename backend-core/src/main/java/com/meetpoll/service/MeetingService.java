package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.ContactGroup;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.ParticipantBinding;
import com.meetpoll.domain.model.SuggestedSlot;
import com.meetpoll.domain.model.TimeSlot;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.InvalidStateException;
import com.meetpoll.exception.MeetingCancelledException;
import com.meetpoll.exception.MeetingFinalizedException;
import com.meetpoll.exception.UnknownSlotException;
import com.meetpoll.notification.DispatchReport;
import com.meetpoll.notification.Envelope;
import com.meetpoll.repository.MeetingRepository;
import com.meetpoll.repository.OrganizerRepository;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.repository.SlotResponseRepository;
import com.meetpoll.repository.SuggestedSlotRepository;
import com.meetpoll.repository.TimeSlotRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.SlotFormats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Meeting lifecycle for organizers: create as draft, send invitations, adjust participants and
 * slots while the poll is open, cancel or delete. Status changes are conditional updates so two
 * racing requests cannot both win. Notifications go out after the transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingService {

    static final int DEFAULT_DURATION_MINUTES = 60;
    private static final Set<MeetingStatus> OPEN = EnumSet.of(MeetingStatus.DRAFT, MeetingStatus.SENT);

    private final MeetingRepository meetingRepository;
    private final TimeSlotRepository slotRepository;
    private final ParticipantBindingRepository bindingRepository;
    private final SlotResponseRepository responseRepository;
    private final SuggestedSlotRepository suggestionRepository;
    private final OrganizerRepository organizerRepository;
    private final ContactService contactService;
    private final ContactGroupService groupService;
    private final ParticipantTokenService tokenService;
    private final SlotRankingService rankingService;
    private final NotificationService notificationService;
    private final MeetingLookup meetingLookup;
    private final MeetPollProperties properties;
    private final StorageTransactions storage;

    public MeetingSummary createMeeting(OrganizerContext ctx, MeetingDraft draft) {
        if (draft == null || draft.title() == null || draft.title().isBlank()) {
            throw new InvalidArgumentException("Meeting title is required");
        }
        if (draft.slots().isEmpty()) {
            throw new InvalidArgumentException("At least one time slot is required");
        }
        draft.slots().forEach(MeetingService::validateProposal);
        if (draft.contactIds().isEmpty() && draft.groupId() == null) {
            throw new InvalidArgumentException("At least one participant is required");
        }

        MeetingSummary summary = storage.write(() -> {
            Map<UUID, Contact> participants = resolveParticipants(ctx, draft);
            if (participants.isEmpty()) {
                throw new InvalidArgumentException("At least one participant is required");
            }

            Meeting meeting = new Meeting();
            meeting.setOrganizer(organizerRepository.getReferenceById(ctx.organizerId()));
            meeting.setTitle(draft.title().trim());
            meeting.setDescription(blankToNull(draft.description()));
            meeting.setStatus(MeetingStatus.DRAFT);
            meeting = meetingRepository.saveAndFlush(meeting);

            for (SlotProposal proposal : draft.slots()) {
                slotRepository.save(newSlot(meeting, proposal));
            }
            for (Contact contact : participants.values()) {
                tokenService.bindingFor(meeting, contact);
            }
            slotRepository.flush();
            return toSummary(meeting, draft.slots().size(), participants.size(), 0);
        });
        log.info("Created meeting {} with {} slots and {} participants",
                summary.id(), summary.slotCount(), summary.invited());
        return summary;
    }

    /**
     * Moves a draft to sent and invites every participant. Calling it again on a sent meeting is a no-op.
     */
    public InvitationReport sendInvitations(OrganizerContext ctx, UUID meetingId) {
        InvitationPlan plan = storage.write(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            rejectTerminal(meeting);
            if (meeting.getStatus() == MeetingStatus.SENT) {
                return InvitationPlan.noop();
            }
            int moved = meetingRepository.transition(meetingId, EnumSet.of(MeetingStatus.DRAFT), MeetingStatus.SENT);
            if (moved == 0) {
                Meeting current = meetingLookup.requireOwned(ctx, meetingId);
                rejectTerminal(current);
                return InvitationPlan.noop();
            }
            return new InvitationPlan(true, participantEnvelopes(ctx, meeting, false));
        });
        if (!plan.transitioned()) {
            log.debug("Meeting {} already sent, skipping invitations", meetingId);
            return new InvitationReport(meetingId, false, DispatchReport.empty());
        }
        DispatchReport report = notificationService.dispatch(NotificationKind.INVITATION, plan.envelopes());
        log.info("Sent meeting {}: {} invitations delivered, {} failed", meetingId, report.succeeded(), report.failed());
        return new InvitationReport(meetingId, true, report);
    }

    public InvitationReport createAndSend(OrganizerContext ctx, MeetingDraft draft) {
        MeetingSummary summary = createMeeting(ctx, draft);
        return sendInvitations(ctx, summary.id());
    }

    public DispatchReport sendReminders(OrganizerContext ctx, UUID meetingId) {
        List<Envelope> envelopes = storage.read(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireSent(meeting);
            return participantEnvelopes(ctx, meeting, true);
        });
        return notificationService.dispatch(NotificationKind.REMINDER, envelopes);
    }

    /**
     * Adds contacts to an open meeting. Already-bound contacts are skipped; on a sent meeting the
     * new participants are invited right away.
     */
    public ParticipantsAdded addParticipants(OrganizerContext ctx, UUID meetingId, List<UUID> contactIds) {
        if (contactIds == null || contactIds.isEmpty()) {
            throw new InvalidArgumentException("No contacts given");
        }
        AddPlan plan = storage.writeWithRetry(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireOpen(meeting);
            List<ParticipantBinding> added = new ArrayList<>();
            for (UUID contactId : new LinkedHashSet<>(contactIds)) {
                if (contactId == null) {
                    throw new InvalidArgumentException("Contact id is required");
                }
                Contact contact = contactService.requireVisibleContact(ctx, contactId);
                if (bindingRepository.findByMeeting_IdAndContact_Id(meetingId, contactId).isPresent()) {
                    continue;
                }
                added.add(tokenService.bindingFor(meeting, contact));
            }
            List<ContactView> views = added.stream().map(b -> ContactView.of(b.getContact())).toList();
            List<Envelope> envelopes = List.of();
            if (meeting.getStatus() == MeetingStatus.SENT && !added.isEmpty()) {
                List<String> labels = slotLabels(meetingId);
                envelopes = added.stream()
                        .map(b -> notificationService.participantEnvelope(b, meeting, ctx.email(), labels))
                        .toList();
            }
            return new AddPlan(views, envelopes);
        });
        DispatchReport report = notificationService.dispatch(NotificationKind.INVITATION, plan.envelopes());
        log.info("Added {} participants to meeting {}", plan.added().size(), meetingId);
        return new ParticipantsAdded(plan.added(), report);
    }

    public SlotView addSlot(OrganizerContext ctx, UUID meetingId, SlotProposal proposal) {
        validateProposal(proposal);
        return storage.write(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireOpen(meeting);
            TimeSlot slot = slotRepository.saveAndFlush(newSlot(meeting, proposal));
            return toSlotView(slot, properties.safeZone());
        });
    }

    /**
     * Deletes a slot with every response given for it. The last remaining slot cannot be removed.
     */
    public void deleteSlot(OrganizerContext ctx, UUID meetingId, UUID slotId) {
        storage.run(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireOpen(meeting);
            TimeSlot slot = slotRepository.findByIdAndMeeting_Id(slotId, meetingId)
                    .orElseThrow(() -> new UnknownSlotException(slotId));
            if (slotRepository.countByMeeting_Id(meetingId) <= 1) {
                throw new InvalidStateException("Meeting %s needs at least one time slot", meetingId);
            }
            int removed = responseRepository.deleteBySlotId(slotId);
            slotRepository.delete(slot);
            log.debug("Deleted slot {} of meeting {} with {} responses", slotId, meetingId, removed);
        });
    }

    /**
     * Tells every participant of a sent meeting that the proposed slots changed.
     */
    public DispatchReport notifyScheduleUpdate(OrganizerContext ctx, UUID meetingId) {
        List<Envelope> envelopes = storage.read(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            requireSent(meeting);
            return participantEnvelopes(ctx, meeting, false);
        });
        return notificationService.dispatch(NotificationKind.SCHEDULE_UPDATE, envelopes);
    }

    /**
     * Cancels a draft or sent meeting. Returns false when it was already cancelled.
     */
    public boolean cancelMeeting(OrganizerContext ctx, UUID meetingId) {
        return storage.write(() -> {
            meetingLookup.requireOwned(ctx, meetingId);
            int moved = meetingRepository.transition(meetingId, OPEN, MeetingStatus.CANCELLED);
            if (moved == 1) {
                log.info("Cancelled meeting {}", meetingId);
                return true;
            }
            Meeting current = meetingLookup.requireOwned(ctx, meetingId);
            if (current.getStatus() == MeetingStatus.FINALIZED) {
                throw new MeetingFinalizedException(meetingId);
            }
            return false;
        });
    }

    /**
     * Removes the meeting and everything hanging off it: responses, suggestions, slots and bindings.
     */
    public void deleteMeeting(OrganizerContext ctx, UUID meetingId) {
        storage.run(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            responseRepository.deleteByMeetingId(meetingId);
            suggestionRepository.deleteByMeetingId(meetingId);
            slotRepository.deleteByMeetingId(meetingId);
            bindingRepository.deleteByMeetingId(meetingId);
            meetingRepository.delete(meeting);
        });
        log.info("Deleted meeting {}", meetingId);
    }

    public List<MeetingSummary> listMeetings(OrganizerContext ctx) {
        return storage.read(() -> meetingRepository.findByOrganizer_IdOrderByCreatedAtDesc(ctx.organizerId()).stream()
                .map(this::summarize)
                .toList());
    }

    public MeetingSummary getMeeting(OrganizerContext ctx, UUID meetingId) {
        return storage.read(() -> summarize(meetingLookup.requireOwned(ctx, meetingId)));
    }

    public MeetingOverview getOverview(OrganizerContext ctx, UUID meetingId) {
        return storage.read(() -> {
            Meeting meeting = meetingLookup.requireOwned(ctx, meetingId);
            ZoneId zone = properties.safeZone();
            List<TimeSlot> slots = slotRepository.findByMeeting_IdOrderByStartsAtAsc(meetingId);
            List<ParticipantBinding> bindings = bindingRepository.findByMeeting_IdOrderByContact_NameAsc(meetingId);
            int responded = (int) bindings.stream().filter(ParticipantBinding::isResponded).count();

            List<ParticipantStatus> participants = bindings.stream()
                    .map(b -> new ParticipantStatus(
                            b.getContact().getId(),
                            b.getContact().getName(),
                            b.getContact().getEmail(),
                            b.isResponded(),
                            b.getRespondedAt(),
                            notificationService.responseLink(b.getToken())))
                    .toList();
            List<SuggestionView> suggestions = suggestionRepository.findByMeeting_IdOrderBySuggestedAtAsc(meetingId)
                    .stream()
                    .map(s -> toSuggestionView(s, zone))
                    .toList();
            List<RankedSlot> ranking = rankingService.rank(slots, responseRepository.findByMeeting_Id(meetingId),
                    bindings.size());

            return new MeetingOverview(
                    toSummary(meeting, slots.size(), bindings.size(), responded),
                    slots.stream().map(slot -> toSlotView(slot, zone)).toList(),
                    participants,
                    ranking,
                    suggestions
            );
        });
    }

    private Map<UUID, Contact> resolveParticipants(OrganizerContext ctx, MeetingDraft draft) {
        Map<UUID, Contact> participants = new LinkedHashMap<>();
        for (UUID contactId : draft.contactIds()) {
            if (contactId == null) {
                throw new InvalidArgumentException("Contact id is required");
            }
            participants.putIfAbsent(contactId, contactService.requireVisibleContact(ctx, contactId));
        }
        if (draft.groupId() != null) {
            ContactGroup group = groupService.requireReadableGroup(ctx, draft.groupId());
            Map<UUID, Contact> members = new LinkedHashMap<>();
            for (Contact member : groupService.members(group.getId())) {
                members.put(member.getId(), member);
            }
            if (draft.groupMemberIds().isEmpty()) {
                members.forEach(participants::putIfAbsent);
            } else {
                for (UUID memberId : draft.groupMemberIds()) {
                    Contact member = members.get(memberId);
                    if (member == null) {
                        throw new InvalidArgumentException("Contact %s is not a member of group %s",
                                memberId, draft.groupId());
                    }
                    participants.putIfAbsent(memberId, member);
                }
            }
        }
        return participants;
    }

    private List<Envelope> participantEnvelopes(OrganizerContext ctx, Meeting meeting, boolean pendingOnly) {
        List<String> labels = slotLabels(meeting.getId());
        return bindingRepository.findByMeeting_IdOrderByContact_NameAsc(meeting.getId()).stream()
                .filter(b -> !pendingOnly || !b.isResponded())
                .map(b -> notificationService.participantEnvelope(b, meeting, ctx.email(), labels))
                .toList();
    }

    private List<String> slotLabels(UUID meetingId) {
        ZoneId zone = properties.safeZone();
        return slotRepository.findByMeeting_IdOrderByStartsAtAsc(meetingId).stream()
                .map(slot -> SlotFormats.withDuration(slot.getStartsAt(), slot.getDurationMinutes(), zone))
                .toList();
    }

    private MeetingSummary summarize(Meeting meeting) {
        UUID id = meeting.getId();
        List<ParticipantBinding> bindings = bindingRepository.findByMeeting_IdOrderByContact_NameAsc(id);
        int responded = (int) bindings.stream().filter(ParticipantBinding::isResponded).count();
        return toSummary(meeting, (int) slotRepository.countByMeeting_Id(id), bindings.size(), responded);
    }

    private static MeetingSummary toSummary(Meeting meeting, int slotCount, int invited, int responded) {
        return new MeetingSummary(
                meeting.getId(),
                meeting.getTitle(),
                meeting.getDescription(),
                meeting.getStatus(),
                meeting.getFinalizedSlot(),
                meeting.getCreatedAt(),
                slotCount,
                invited,
                responded
        );
    }

    static SlotView toSlotView(TimeSlot slot, ZoneId zone) {
        return new SlotView(slot.getId(), slot.getStartsAt(), slot.getDurationMinutes(),
                SlotFormats.withDuration(slot.getStartsAt(), slot.getDurationMinutes(), zone));
    }

    static SuggestionView toSuggestionView(SuggestedSlot suggestion, ZoneId zone) {
        return new SuggestionView(
                suggestion.getContact().getId(),
                suggestion.getContact().getName(),
                suggestion.getSuggestedAt(),
                SlotFormats.longForm(suggestion.getSuggestedAt(), zone),
                suggestion.getNote()
        );
    }

    private static TimeSlot newSlot(Meeting meeting, SlotProposal proposal) {
        TimeSlot slot = new TimeSlot();
        slot.setMeeting(meeting);
        slot.setStartsAt(proposal.startsAt());
        slot.setDurationMinutes(proposal.durationMinutes() == null
                ? DEFAULT_DURATION_MINUTES
                : proposal.durationMinutes());
        return slot;
    }

    private static void validateProposal(SlotProposal proposal) {
        if (proposal == null || proposal.startsAt() == null) {
            throw new InvalidArgumentException("Time slot start is required");
        }
        if (proposal.durationMinutes() != null && proposal.durationMinutes() <= 0) {
            throw new InvalidArgumentException("Time slot duration must be positive");
        }
    }

    private static void requireOpen(Meeting meeting) {
        rejectTerminal(meeting);
    }

    private static void requireSent(Meeting meeting) {
        rejectTerminal(meeting);
        if (meeting.getStatus() != MeetingStatus.SENT) {
            throw new InvalidStateException("Meeting %s has not been sent yet", meeting.getId());
        }
    }

    private static void rejectTerminal(Meeting meeting) {
        if (meeting.getStatus() == MeetingStatus.CANCELLED) {
            throw new MeetingCancelledException(meeting.getId());
        }
        if (meeting.getStatus() == MeetingStatus.FINALIZED) {
            throw new MeetingFinalizedException(meeting.getId());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record InvitationPlan(boolean transitioned, List<Envelope> envelopes) {
        static InvitationPlan noop() {
            return new InvitationPlan(false, List.of());
        }
    }

    private record AddPlan(List<ContactView> added, List<Envelope> envelopes) {
    }

    public record InvitationReport(UUID meetingId, boolean sent, DispatchReport dispatch) {
    }

    public record ParticipantsAdded(List<ContactView> added, DispatchReport dispatch) {
    }
}
