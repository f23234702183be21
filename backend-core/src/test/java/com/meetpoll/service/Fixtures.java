package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.Availability;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.ContactGroup;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.Organizer;
import com.meetpoll.domain.model.ParticipantBinding;
import com.meetpoll.domain.model.SlotResponse;
import com.meetpoll.domain.model.TimeSlot;
import com.meetpoll.storage.StorageErrorTranslator;
import com.meetpoll.storage.StorageTransactions;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.Mockito.mock;

final class Fixtures {

    static final Instant MONDAY_9AM = Instant.parse("2024-03-04T09:00:00Z");

    private Fixtures() {
    }

    static MeetPollProperties properties() {
        return new MeetPollProperties("http://scheduler.test/", "UTC", null, null, null, null);
    }

    /**
     * Real transaction boundary over a mocked transaction manager: work runs inline, while the
     * retry and exception translation logic stays in play.
     */
    static StorageTransactions storage() {
        return new StorageTransactions(mock(PlatformTransactionManager.class), properties(), new StorageErrorTranslator());
    }

    static Organizer organizer(String email) {
        Organizer organizer = new Organizer();
        organizer.setId(UUID.randomUUID());
        organizer.setEmail(email);
        organizer.setDisplayName(email.substring(0, email.indexOf('@')));
        organizer.setPasswordHash("hash");
        organizer.setRecoveryHash("recovery");
        return organizer;
    }

    static OrganizerContext context(Organizer organizer) {
        return new OrganizerContext(organizer.getId(), organizer.getEmail());
    }

    static Contact contact(Organizer owner, String name, String email) {
        Contact contact = new Contact();
        contact.setId(UUID.randomUUID());
        contact.setOwner(owner);
        contact.setName(name);
        contact.setEmail(email);
        return contact;
    }

    static ContactGroup group(Organizer owner, String name) {
        ContactGroup group = new ContactGroup();
        group.setId(UUID.randomUUID());
        group.setOwner(owner);
        group.setName(name);
        return group;
    }

    static Meeting meeting(Organizer organizer, MeetingStatus status) {
        Meeting meeting = new Meeting();
        meeting.setId(UUID.randomUUID());
        meeting.setOrganizer(organizer);
        meeting.setTitle("Planning");
        meeting.setDescription("Quarterly planning");
        meeting.setStatus(status);
        return meeting;
    }

    static TimeSlot slot(Meeting meeting, Instant startsAt) {
        TimeSlot slot = new TimeSlot();
        slot.setId(UUID.randomUUID());
        slot.setMeeting(meeting);
        slot.setStartsAt(startsAt);
        slot.setDurationMinutes(60);
        return slot;
    }

    static ParticipantBinding binding(Meeting meeting, Contact contact, String token) {
        ParticipantBinding binding = new ParticipantBinding();
        binding.setId(UUID.randomUUID());
        binding.setMeeting(meeting);
        binding.setContact(contact);
        binding.setToken(token);
        return binding;
    }

    static SlotResponse response(TimeSlot slot, Contact contact, Availability availability) {
        SlotResponse response = new SlotResponse();
        response.setId(UUID.randomUUID());
        response.setMeeting(slot.getMeeting());
        response.setSlot(slot);
        response.setContact(contact);
        response.setAvailability(availability);
        return response;
    }
}
