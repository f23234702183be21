package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.domain.enums.Availability;
import com.meetpoll.domain.enums.DeliveryStatus;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.ParticipantBinding;
import com.meetpoll.domain.model.SlotResponse;
import com.meetpoll.domain.model.SuggestedSlot;
import com.meetpoll.domain.model.TimeSlot;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.InvalidStateException;
import com.meetpoll.exception.InvalidTokenException;
import com.meetpoll.exception.MeetingCancelledException;
import com.meetpoll.exception.MeetingFinalizedException;
import com.meetpoll.exception.UnknownSlotException;
import com.meetpoll.notification.Envelope;
import com.meetpoll.repository.MeetingRepository;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.repository.SlotResponseRepository;
import com.meetpoll.repository.SuggestedSlotRepository;
import com.meetpoll.repository.TimeSlotRepository;
import com.meetpoll.storage.StorageTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Participant side of a poll, authenticated by response token only. Answers are upserts keyed by
 * (meeting, contact, slot), so resubmitting replaces earlier answers. Submissions hold a shared
 * lock on the meeting row, which orders them against finalize and cancel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseCollectorService {

    static final int MAX_NOTE_LENGTH = 1000;

    private final ParticipantBindingRepository bindingRepository;
    private final MeetingRepository meetingRepository;
    private final TimeSlotRepository slotRepository;
    private final SlotResponseRepository responseRepository;
    private final SuggestedSlotRepository suggestionRepository;
    private final NotificationService notificationService;
    private final MeetPollProperties properties;
    private final StorageTransactions storage;

    public SubmissionReceipt submitResponse(String token, UUID slotId, Availability availability) {
        requireTokenPresent(token);
        if (slotId == null || availability == null) {
            throw new InvalidArgumentException("Every answer needs a slot and an availability");
        }
        return submitAll(token, Map.of(slotId, availability), null);
    }

    /**
     * Records answers for any subset of the meeting's slots, plus an optional alternative time.
     * The organizer is notified once the submission has committed.
     */
    public SubmissionReceipt submitAll(String token, Map<UUID, Availability> answers, AlternativeTime alternative) {
        requireTokenPresent(token);
        Map<UUID, Availability> normalized = answers == null ? Map.of() : answers;
        if (normalized.isEmpty() && alternative == null) {
            throw new InvalidArgumentException("Nothing to submit");
        }
        normalized.forEach((slotId, availability) -> {
            if (slotId == null || availability == null) {
                throw new InvalidArgumentException("Every answer needs a slot and an availability");
            }
        });
        validateAlternative(alternative);

        Submission submission = storage.writeWithRetry(() -> {
            ParticipantBinding binding = requireBinding(token);
            UUID meetingId = binding.getMeeting().getId();
            UUID contactId = binding.getContact().getId();
            Meeting meeting = meetingRepository.findForResponse(meetingId)
                    .orElseThrow(InvalidTokenException::new);
            requireAcceptingResponses(meeting);

            Map<UUID, TimeSlot> slots = slotRepository.findByMeeting_IdOrderByStartsAtAsc(meetingId).stream()
                    .collect(Collectors.toMap(TimeSlot::getId, Function.identity()));
            for (UUID slotId : normalized.keySet()) {
                if (!slots.containsKey(slotId)) {
                    throw new UnknownSlotException(slotId);
                }
            }

            OffsetDateTime now = OffsetDateTime.now();
            for (Map.Entry<UUID, Availability> answer : normalized.entrySet()) {
                SlotResponse response = responseRepository
                        .findByMeeting_IdAndContact_IdAndSlot_Id(meetingId, contactId, answer.getKey())
                        .orElseGet(() -> {
                            SlotResponse fresh = new SlotResponse();
                            fresh.setMeeting(meeting);
                            fresh.setContact(binding.getContact());
                            fresh.setSlot(slots.get(answer.getKey()));
                            return fresh;
                        });
                response.setAvailability(answer.getValue());
                response.setAnsweredAt(now);
                responseRepository.saveAndFlush(response);
            }
            if (alternative != null) {
                replaceSuggestion(binding, meeting, alternative);
            }

            boolean first = !binding.isResponded();
            binding.setResponded(true);
            binding.setRespondedAt(now);
            bindingRepository.saveAndFlush(binding);

            Envelope organizerNotice = notificationService.organizerEnvelope(
                    meeting.getOrganizer().getEmail(), binding.getContact().getName(), meetingId, meeting.getTitle());
            return new Submission(meetingId, contactId, normalized.size(), first, organizerNotice);
        });

        DeliveryStatus notified = notificationService.send(NotificationKind.RESPONSE_RECEIVED, submission.organizerNotice());
        log.info("Recorded {} answers for meeting {} from contact {}",
                submission.recorded(), submission.meetingId(), submission.contactId());
        return new SubmissionReceipt(submission.meetingId(), submission.recorded(), submission.first(),
                alternative != null, notified);
    }

    public SuggestionView suggestAlternative(String token, Instant suggestedAt, String note) {
        requireTokenPresent(token);
        AlternativeTime alternative = new AlternativeTime(suggestedAt, note);
        validateAlternative(alternative);
        return storage.writeWithRetry(() -> {
            ParticipantBinding binding = requireBinding(token);
            Meeting meeting = meetingRepository.findForResponse(binding.getMeeting().getId())
                    .orElseThrow(InvalidTokenException::new);
            requireAcceptingResponses(meeting);
            return MeetingService.toSuggestionView(replaceSuggestion(binding, meeting, alternative), properties.safeZone());
        });
    }

    /**
     * Everything the response page needs. Works for every status so a participant of a finalized
     * or cancelled meeting still sees the outcome.
     */
    public ParticipantView viewInvitation(String token) {
        return storage.read(() -> {
            ParticipantBinding binding = requireBinding(token);
            Meeting meeting = binding.getMeeting();
            UUID meetingId = meeting.getId();
            UUID contactId = binding.getContact().getId();
            ZoneId zone = properties.safeZone();

            Map<UUID, Availability> answers = new LinkedHashMap<>();
            for (SlotResponse response : responseRepository.findByMeeting_IdAndContact_Id(meetingId, contactId)) {
                answers.put(response.getSlot().getId(), response.getAvailability());
            }
            SuggestionView suggestion = suggestionRepository.findByMeeting_IdAndContact_Id(meetingId, contactId)
                    .map(s -> MeetingService.toSuggestionView(s, zone))
                    .orElse(null);
            List<SlotView> slots = slotRepository.findByMeeting_IdOrderByStartsAtAsc(meetingId).stream()
                    .map(slot -> MeetingService.toSlotView(slot, zone))
                    .toList();

            return new ParticipantView(
                    meetingId,
                    meeting.getTitle(),
                    meeting.getDescription(),
                    meeting.getStatus(),
                    meeting.getFinalizedSlot(),
                    meeting.getOrganizer().getEmail(),
                    binding.getContact().getName(),
                    binding.isResponded(),
                    slots,
                    answers,
                    suggestion
            );
        });
    }

    /**
     * Current answers of one participant keyed by slot id; slots without an answer are absent.
     */
    public Map<UUID, Availability> currentAnswers(String token) {
        return storage.read(() -> {
            ParticipantBinding binding = requireBinding(token);
            Map<UUID, Availability> answers = new HashMap<>();
            for (SlotResponse response : responseRepository.findByMeeting_IdAndContact_Id(
                    binding.getMeeting().getId(), binding.getContact().getId())) {
                answers.put(response.getSlot().getId(), response.getAvailability());
            }
            return answers;
        });
    }

    // A missing link fails like an unknown one, before any body validation.
    private static void requireTokenPresent(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException();
        }
    }

    private ParticipantBinding requireBinding(String token) {
        requireTokenPresent(token);
        return bindingRepository.findByToken(token.trim()).orElseThrow(InvalidTokenException::new);
    }

    private SuggestedSlot replaceSuggestion(ParticipantBinding binding, Meeting meeting, AlternativeTime alternative) {
        suggestionRepository.deleteSuggestion(meeting.getId(), binding.getContact().getId());
        SuggestedSlot suggestion = new SuggestedSlot();
        suggestion.setMeeting(meeting);
        suggestion.setContact(binding.getContact());
        suggestion.setSuggestedAt(alternative.suggestedAt());
        suggestion.setNote(alternative.note() == null || alternative.note().isBlank() ? null : alternative.note().trim());
        return suggestionRepository.saveAndFlush(suggestion);
    }

    private static void validateAlternative(AlternativeTime alternative) {
        if (alternative == null) {
            return;
        }
        if (alternative.suggestedAt() == null) {
            throw new InvalidArgumentException("Suggested time is required");
        }
        if (alternative.note() != null && alternative.note().length() > MAX_NOTE_LENGTH) {
            throw new InvalidArgumentException("Note must be at most %d characters", MAX_NOTE_LENGTH);
        }
    }

    private static void requireAcceptingResponses(Meeting meeting) {
        MeetingStatus status = meeting.getStatus();
        if (status == MeetingStatus.CANCELLED) {
            throw new MeetingCancelledException(meeting.getId());
        }
        if (status == MeetingStatus.FINALIZED) {
            throw new MeetingFinalizedException(meeting.getId());
        }
        if (status != MeetingStatus.SENT) {
            throw new InvalidStateException("Meeting %s is not open for responses yet", meeting.getId());
        }
    }

    public record AlternativeTime(Instant suggestedAt, String note) {
    }

    private record Submission(UUID meetingId, UUID contactId, int recorded, boolean first, Envelope organizerNotice) {
    }

    /**
     * @param firstSubmission true when this was the participant's first answer for the meeting
     * @param organizerNotified delivery status of the "new response" notice to the organizer
     */
    public record SubmissionReceipt(
            UUID meetingId,
            int recorded,
            boolean firstSubmission,
            boolean suggestionRecorded,
            DeliveryStatus organizerNotified
    ) {
    }
}
