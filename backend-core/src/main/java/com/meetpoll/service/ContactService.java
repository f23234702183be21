package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.exception.ContactInUseException;
import com.meetpoll.exception.ForbiddenException;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.repository.ContactGroupRepository;
import com.meetpoll.repository.ContactRepository;
import com.meetpoll.repository.GroupMembershipRepository;
import com.meetpoll.repository.OrganizerRepository;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Per-organizer address book. A contact is unique per (owner, canonical email); creating an
 * existing one returns it unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactService {

    private final ContactRepository contactRepository;
    private final OrganizerRepository organizerRepository;
    private final ContactGroupRepository contactGroupRepository;
    private final GroupMembershipRepository membershipRepository;
    private final ParticipantBindingRepository bindingRepository;
    private final StorageTransactions storage;

    public ContactView createContact(OrganizerContext ctx, String name, String email) {
        String canonical = requireEmail(email);
        String trimmedName = requireName(name);
        return storage.writeWithRetry(() -> ContactView.of(
                contactRepository.findByOwner_IdAndEmail(ctx.organizerId(), canonical)
                        .orElseGet(() -> {
                            Contact contact = new Contact();
                            contact.setOwner(organizerRepository.getReferenceById(ctx.organizerId()));
                            contact.setName(trimmedName);
                            contact.setEmail(canonical);
                            Contact saved = contactRepository.saveAndFlush(contact);
                            log.debug("Created contact {} for organizer {}", saved.getId(), ctx.organizerId());
                            return saved;
                        })));
    }

    public ContactView updateContact(OrganizerContext ctx, UUID contactId, String name, String email) {
        String canonical = requireEmail(email);
        String trimmedName = requireName(name);
        return storage.write(() -> {
            Contact contact = requireOwnedContact(ctx, contactId);
            contact.setName(trimmedName);
            contact.setEmail(canonical);
            return ContactView.of(contactRepository.saveAndFlush(contact));
        });
    }

    /**
     * Deletes an owned contact together with its group memberships. A contact still bound to a
     * meeting is kept and the blocking meetings are reported instead.
     */
    public ContactDeletion deleteContact(OrganizerContext ctx, UUID contactId) {
        try {
            return storage.write(() -> {
                Contact contact = requireOwnedContact(ctx, contactId);
                List<MeetingRef> blocking = bindingRepository.findByContact_Id(contactId).stream()
                        .map(binding -> MeetingRef.of(binding.getMeeting()))
                        .toList();
                if (!blocking.isEmpty()) {
                    return ContactDeletion.inUse(blocking);
                }
                membershipRepository.deleteByContactId(contactId);
                contactRepository.delete(contact);
                contactRepository.flush();
                return ContactDeletion.deleted();
            });
        } catch (ContactInUseException e) {
            log.info("Contact {} was invited concurrently, keeping it", contactId);
            return ContactDeletion.inUse(List.of());
        }
    }

    public List<ContactView> listContacts(OrganizerContext ctx) {
        return storage.read(() -> contactRepository.findByOwner_IdOrderByNameAsc(ctx.organizerId()).stream()
                .map(ContactView::of)
                .toList());
    }

    public ContactView getContact(OrganizerContext ctx, UUID contactId) {
        return storage.read(() -> ContactView.of(requireVisibleContact(ctx, contactId)));
    }

    /**
     * The caller's own groups that contain the contact.
     */
    public List<GroupRef> getContactGroups(OrganizerContext ctx, UUID contactId) {
        return storage.read(() -> {
            requireOwnedContact(ctx, contactId);
            return contactGroupRepository.findByMember(contactId).stream()
                    .map(group -> new GroupRef(group.getId(), group.getName()))
                    .toList();
        });
    }

    /**
     * Meetings the contact is invited to; empty means the contact can be deleted.
     */
    public List<MeetingRef> contactInUse(OrganizerContext ctx, UUID contactId) {
        return storage.read(() -> {
            requireOwnedContact(ctx, contactId);
            return bindingRepository.findByContact_Id(contactId).stream()
                    .map(binding -> MeetingRef.of(binding.getMeeting()))
                    .toList();
        });
    }

    /**
     * A contact is visible to its owner and to grantees of a shared group that contains it.
     * Joins the caller's transaction.
     */
    Contact requireVisibleContact(OrganizerContext ctx, UUID contactId) {
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(() -> new NotFoundException("Contact %s not found", contactId));
        if (contact.getOwner().getId().equals(ctx.organizerId())) {
            return contact;
        }
        if (contactRepository.countSharedMemberships(contactId, ctx.email()) > 0) {
            return contact;
        }
        throw new NotFoundException("Contact %s not found", contactId);
    }

    private Contact requireOwnedContact(OrganizerContext ctx, UUID contactId) {
        Contact contact = requireVisibleContact(ctx, contactId);
        if (!contact.getOwner().getId().equals(ctx.organizerId())) {
            throw new ForbiddenException("Contact %s belongs to another organizer", contactId);
        }
        return contact;
    }

    private static String requireEmail(String email) {
        if (!EmailAddresses.looksValid(email)) {
            throw new InvalidArgumentException("Invalid email address: %s", email);
        }
        return EmailAddresses.canonical(email);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Contact name is required");
        }
        return name.trim();
    }

    public record GroupRef(UUID id, String name) {
    }

    public record MeetingRef(UUID id, String title, MeetingStatus status) {

        static MeetingRef of(Meeting meeting) {
            return new MeetingRef(meeting.getId(), meeting.getTitle(), meeting.getStatus());
        }
    }

    public record ContactDeletion(boolean removed, List<MeetingRef> blockingMeetings) {

        static ContactDeletion deleted() {
            return new ContactDeletion(true, List.of());
        }

        static ContactDeletion inUse(List<MeetingRef> meetings) {
            return new ContactDeletion(false, List.copyOf(meetings));
        }
    }
}
