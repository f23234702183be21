package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.domain.enums.DeliveryStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.ParticipantBinding;
import com.meetpoll.notification.DispatchReport;
import com.meetpoll.notification.Envelope;
import com.meetpoll.notification.NotificationPayload;
import com.meetpoll.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Builds notification envelopes and fans them out through the {@link Notifier}. Dispatch is
 * always called after the mutation that triggered it has committed; a failed delivery never
 * rolls anything back and is only counted in the returned {@link DispatchReport}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final Notifier notifier;
    private final MeetPollProperties properties;

    public String responseLink(String token) {
        return properties.safePublicBaseUrl() + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    public String dashboardLink(UUID meetingId) {
        return properties.safePublicBaseUrl() + "?page=organizer&meeting_id=" + meetingId;
    }

    /**
     * Envelope addressed to an invited participant. Reads the binding's contact, so call it
     * while the loading transaction is still open.
     */
    public Envelope participantEnvelope(ParticipantBinding binding, Meeting meeting,
                                        String organizerEmail, List<String> slots) {
        NotificationPayload payload = new NotificationPayload(
                binding.getContact().getName(),
                meeting.getTitle(),
                meeting.getDescription(),
                organizerEmail,
                slots,
                responseLink(binding.getToken())
        );
        return new Envelope(binding.getContact().getEmail(), payload);
    }

    public Envelope organizerEnvelope(String organizerEmail, String participantName, UUID meetingId, String meetingTitle) {
        NotificationPayload payload = new NotificationPayload(
                participantName,
                meetingTitle,
                null,
                organizerEmail,
                List.of(),
                dashboardLink(meetingId)
        );
        return new Envelope(organizerEmail, payload);
    }

    public DispatchReport dispatch(NotificationKind kind, List<Envelope> envelopes) {
        if (envelopes == null || envelopes.isEmpty()) {
            return DispatchReport.empty();
        }
        DispatchReport.Tally tally = new DispatchReport.Tally();
        for (Envelope envelope : envelopes) {
            tally.record(envelope.recipient(), send(kind, envelope));
        }
        DispatchReport report = tally.toReport();
        log.info("Dispatched {} notifications: delivered={}, simulated={}, failed={}",
                kind, report.delivered(), report.simulated(), report.failed());
        return report;
    }

    public DeliveryStatus send(NotificationKind kind, Envelope envelope) {
        try {
            DeliveryStatus status = notifier.notify(kind, envelope.recipient(), envelope.payload());
            return status == null ? DeliveryStatus.FAILED : status;
        } catch (RuntimeException e) {
            log.error("Failed to dispatch {} notification to {}: {}", kind, envelope.recipient(), e.getMessage(), e);
            return DeliveryStatus.FAILED;
        }
    }
}
