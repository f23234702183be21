package com.meetpoll.notification;

import com.meetpoll.domain.enums.NotificationKind;

import java.util.stream.Collectors;

final class MailTemplates {

    private MailTemplates() {
    }

    record Mail(String subject, String body) {
    }

    static Mail render(NotificationKind kind, NotificationPayload payload) {
        return switch (kind) {
            case INVITATION -> invitation(payload, "Meeting Invitation: ");
            case REMINDER -> invitation(payload, "Reminder: please respond to ");
            case RESPONSE_RECEIVED -> responseReceived(payload);
            case SCHEDULE_UPDATE -> scheduleUpdate(payload);
            case FINALIZED -> finalized(payload);
        };
    }

    static Mail connectionTest() {
        String body = "Email Configuration Test\n\n"
                + "Your SMTP settings are working correctly.\n"
                + "Meeting invitations will now be sent through this account.\n\n"
                + "This is a test email from Meeting Scheduler.\n";
        return new Mail("Meeting Scheduler - Test Email", body);
    }

    private static Mail invitation(NotificationPayload p, String subjectPrefix) {
        String body = "Hello " + p.participantName() + ",\n\n"
                + "You've been invited to participate in scheduling a meeting:\n\n"
                + p.meetingTitle() + "\n"
                + nullToEmpty(p.meetingDescription()) + "\n\n"
                + "Proposed Time Slots:\n"
                + bullets(p) + "\n\n"
                + "Please indicate your availability by visiting:\n"
                + p.link() + "\n\n"
                + "Organized by: " + p.organizerEmail() + "\n";
        return new Mail(subjectPrefix + p.meetingTitle(), body);
    }

    private static Mail responseReceived(NotificationPayload p) {
        String body = "New Response Received\n\n"
                + p.participantName() + " has responded to your meeting invitation:\n"
                + p.meetingTitle() + "\n\n"
                + "View responses at: " + p.link() + "\n";
        return new Mail("Response: " + p.participantName() + " replied to " + p.meetingTitle(), body);
    }

    private static Mail scheduleUpdate(NotificationPayload p) {
        String body = "Schedule Updated\n\n"
                + "Hello " + p.participantName() + ",\n\n"
                + "The proposed time slots have been updated. Please review and indicate your availability:\n\n"
                + p.meetingTitle() + "\n\n"
                + "Updated Time Slots:\n"
                + bullets(p) + "\n\n"
                + "Update your response at: " + p.link() + "\n\n"
                + "Organized by: " + p.organizerEmail() + "\n";
        return new Mail("Updated Schedule: " + p.meetingTitle(), body);
    }

    private static Mail finalized(NotificationPayload p) {
        String body = "Meeting Confirmed\n\n"
                + "Hello " + p.participantName() + ",\n\n"
                + "The meeting has been confirmed for the following time:\n\n"
                + p.meetingTitle() + "\n\n"
                + "Confirmed Time:\n"
                + bullets(p) + "\n\n"
                + "Organized by: " + p.organizerEmail() + "\n";
        return new Mail("Final Schedule: " + p.meetingTitle(), body);
    }

    private static String bullets(NotificationPayload p) {
        return p.slots().stream().map(slot -> "  • " + slot).collect(Collectors.joining("\n"));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
