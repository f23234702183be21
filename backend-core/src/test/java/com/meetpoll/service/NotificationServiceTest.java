package com.meetpoll.service;

import com.meetpoll.domain.enums.DeliveryStatus;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.Organizer;
import com.meetpoll.notification.DispatchReport;
import com.meetpoll.notification.Envelope;
import com.meetpoll.notification.NotificationPayload;
import com.meetpoll.notification.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private Notifier notifier;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notifier, Fixtures.properties());
    }

    @Test
    void dispatch_shouldTallyEveryOutcomeAndKeepGoingAfterErrors() {
        when(notifier.notify(eq(NotificationKind.INVITATION), eq("a@example.com"), any())).thenReturn(DeliveryStatus.DELIVERED);
        when(notifier.notify(eq(NotificationKind.INVITATION), eq("b@example.com"), any()))
                .thenThrow(new IllegalStateException("smtp down"));
        when(notifier.notify(eq(NotificationKind.INVITATION), eq("c@example.com"), any())).thenReturn(DeliveryStatus.SIMULATED);

        DispatchReport report = notificationService.dispatch(NotificationKind.INVITATION, List.of(
                envelope("a@example.com"), envelope("b@example.com"), envelope("c@example.com")));

        assertEquals(1, report.delivered());
        assertEquals(1, report.simulated());
        assertEquals(1, report.failed());
        assertEquals(List.of("b@example.com"), report.failedRecipients());
        assertEquals(2, report.succeeded());
        assertTrue(report.hasFailures());
    }

    @Test
    void dispatch_shouldSkipEmptyFanOut() {
        DispatchReport report = notificationService.dispatch(NotificationKind.REMINDER, List.of());

        assertEquals(0, report.attempted());
        verifyNoInteractions(notifier);
    }

    @Test
    void participantEnvelope_shouldCarryEncodedResponseLink() {
        Organizer organizer = Fixtures.organizer("owner@example.com");
        Meeting meeting = Fixtures.meeting(organizer, MeetingStatus.SENT);
        Contact alice = Fixtures.contact(organizer, "Alice", "alice@example.com");

        Envelope envelope = notificationService.participantEnvelope(
                Fixtures.binding(meeting, alice, "a+b/c"), meeting, "owner@example.com", List.of("slot"));

        assertEquals("alice@example.com", envelope.recipient());
        assertEquals("http://scheduler.test?token=a%2Bb%2Fc", envelope.payload().link());
        assertEquals("Planning", envelope.payload().meetingTitle());
    }

    @Test
    void dashboardLink_shouldPointAtOrganizerPage() {
        UUID meetingId = UUID.randomUUID();

        assertEquals("http://scheduler.test?page=organizer&meeting_id=" + meetingId,
                notificationService.dashboardLink(meetingId));
    }

    private static Envelope envelope(String recipient) {
        return new Envelope(recipient, new NotificationPayload("P", "Planning", null, "owner@example.com", List.of(), "link"));
    }
}
