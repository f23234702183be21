package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.GroupAccess;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.ContactGroup;
import com.meetpoll.domain.model.GroupMembership;
import com.meetpoll.domain.model.GroupShare;
import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.ForbiddenException;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.repository.ContactGroupRepository;
import com.meetpoll.repository.ContactRepository;
import com.meetpoll.repository.GroupMembershipRepository;
import com.meetpoll.repository.GroupShareRepository;
import com.meetpoll.repository.OrganizerRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Contact groups and read-only sharing. Only the owner mutates a group; a grantee sees it while
 * the group is shared and a share for the grantee's email exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactGroupService {

    private final ContactGroupRepository groupRepository;
    private final GroupMembershipRepository membershipRepository;
    private final GroupShareRepository shareRepository;
    private final ContactRepository contactRepository;
    private final OrganizerRepository organizerRepository;
    private final StorageTransactions storage;

    public GroupView createGroup(OrganizerContext ctx, String name, String description) {
        String trimmedName = requireName(name);
        return storage.write(() -> {
            ContactGroup group = new ContactGroup();
            group.setOwner(organizerRepository.getReferenceById(ctx.organizerId()));
            group.setName(trimmedName);
            group.setDescription(blankToNull(description));
            ContactGroup saved = groupRepository.saveAndFlush(group);
            log.debug("Created group {} for organizer {}", saved.getId(), ctx.organizerId());
            return new GroupView(saved.getId(), saved.getName(), saved.getDescription(), false,
                    GroupAccess.OWNED, ctx.email(), 0);
        });
    }

    public GroupView updateGroup(OrganizerContext ctx, UUID groupId, String name, String description) {
        String trimmedName = requireName(name);
        return storage.write(() -> {
            ContactGroup group = requireOwnedGroup(ctx, groupId);
            group.setName(trimmedName);
            group.setDescription(blankToNull(description));
            return toView(groupRepository.saveAndFlush(group), ctx);
        });
    }

    /**
     * Removes the group with its memberships and shares. Contacts and meetings are untouched.
     */
    public void deleteGroup(OrganizerContext ctx, UUID groupId) {
        storage.run(() -> {
            ContactGroup group = requireOwnedGroup(ctx, groupId);
            membershipRepository.deleteByGroupId(groupId);
            shareRepository.deleteByGroupId(groupId);
            groupRepository.delete(group);
        });
        log.info("Deleted group {}", groupId);
    }

    public void addMember(OrganizerContext ctx, UUID groupId, UUID contactId) {
        storage.run(() -> {
            ContactGroup group = requireOwnedGroup(ctx, groupId);
            Contact contact = contactRepository.findById(contactId)
                    .orElseThrow(() -> new NotFoundException("Contact %s not found", contactId));
            if (!contact.getOwner().getId().equals(ctx.organizerId())) {
                throw new ForbiddenException("Contact %s belongs to another organizer", contactId);
            }
            if (membershipRepository.existsByGroup_IdAndContact_Id(groupId, contactId)) {
                throw new ConflictException("Contact %s is already a member of group %s", contactId, groupId);
            }
            GroupMembership membership = new GroupMembership();
            membership.setGroup(group);
            membership.setContact(contact);
            membershipRepository.saveAndFlush(membership);
        });
    }

    public boolean removeMember(OrganizerContext ctx, UUID groupId, UUID contactId) {
        return storage.write(() -> {
            requireOwnedGroup(ctx, groupId);
            return membershipRepository.deleteMembership(groupId, contactId) > 0;
        });
    }

    /**
     * Turning sharing off drops every grant; turning it on again starts from an empty share list.
     */
    public GroupView setShared(OrganizerContext ctx, UUID groupId, boolean shared) {
        return storage.write(() -> {
            ContactGroup group = requireOwnedGroup(ctx, groupId);
            group.setShared(shared);
            if (!shared) {
                int revoked = shareRepository.deleteByGroupId(groupId);
                log.debug("Unshared group {}, revoked {} grants", groupId, revoked);
            }
            return toView(groupRepository.saveAndFlush(group), ctx);
        });
    }

    public void grantShare(OrganizerContext ctx, UUID groupId, String granteeEmail) {
        if (!EmailAddresses.looksValid(granteeEmail)) {
            throw new InvalidArgumentException("Invalid email address: %s", granteeEmail);
        }
        String grantee = EmailAddresses.canonical(granteeEmail);
        if (grantee.equals(ctx.email())) {
            throw new InvalidArgumentException("A group cannot be shared with its owner");
        }
        storage.run(() -> {
            ContactGroup group = requireOwnedGroup(ctx, groupId);
            if (shareRepository.existsByGroup_IdAndGranteeEmail(groupId, grantee)) {
                throw new ConflictException("Group %s is already shared with %s", groupId, grantee);
            }
            group.setShared(true);
            GroupShare share = new GroupShare();
            share.setGroup(group);
            share.setGranteeEmail(grantee);
            shareRepository.saveAndFlush(share);
        });
        log.info("Shared group {} with {}", groupId, grantee);
    }

    public boolean revokeShare(OrganizerContext ctx, UUID groupId, String granteeEmail) {
        String grantee = EmailAddresses.canonical(granteeEmail);
        return storage.write(() -> {
            requireOwnedGroup(ctx, groupId);
            return shareRepository.deleteShare(groupId, grantee) > 0;
        });
    }

    public List<String> listShares(OrganizerContext ctx, UUID groupId) {
        return storage.read(() -> {
            requireOwnedGroup(ctx, groupId);
            return shareRepository.findByGroup_IdOrderByGranteeEmailAsc(groupId).stream()
                    .map(GroupShare::getGranteeEmail)
                    .toList();
        });
    }

    public List<ContactView> listMembers(OrganizerContext ctx, UUID groupId) {
        return storage.read(() -> {
            requireReadableGroup(ctx, groupId);
            return membershipRepository.findByGroup_IdOrderByContact_NameAsc(groupId).stream()
                    .map(membership -> ContactView.of(membership.getContact()))
                    .toList();
        });
    }

    /**
     * Owned groups first, then groups currently shared with the caller, each sorted by name.
     */
    public List<GroupView> listGroups(OrganizerContext ctx) {
        return storage.read(() -> {
            List<GroupView> result = new ArrayList<>();
            for (ContactGroup group : groupRepository.findByOwner_IdOrderByNameAsc(ctx.organizerId())) {
                result.add(toView(group, ctx));
            }
            for (ContactGroup group : groupRepository.findSharedWith(ctx.email())) {
                if (!isOwner(group, ctx)) {
                    result.add(toView(group, ctx));
                }
            }
            return result;
        });
    }

    public GroupView getGroup(OrganizerContext ctx, UUID groupId) {
        return storage.read(() -> toView(requireReadableGroup(ctx, groupId), ctx));
    }

    /**
     * Owner or live grantee; everybody else gets {@link NotFoundException}. Joins the caller's transaction.
     */
    ContactGroup requireReadableGroup(OrganizerContext ctx, UUID groupId) {
        ContactGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> new NotFoundException("Group %s not found", groupId));
        if (isOwner(group, ctx)) {
            return group;
        }
        if (group.isShared() && shareRepository.existsByGroup_IdAndGranteeEmail(groupId, ctx.email())) {
            return group;
        }
        throw new NotFoundException("Group %s not found", groupId);
    }

    List<Contact> members(UUID groupId) {
        return membershipRepository.findByGroup_IdOrderByContact_NameAsc(groupId).stream()
                .map(GroupMembership::getContact)
                .toList();
    }

    private ContactGroup requireOwnedGroup(OrganizerContext ctx, UUID groupId) {
        ContactGroup group = requireReadableGroup(ctx, groupId);
        if (!isOwner(group, ctx)) {
            throw new ForbiddenException("Group %s is shared with you read-only", groupId);
        }
        return group;
    }

    private GroupView toView(ContactGroup group, OrganizerContext ctx) {
        boolean owner = isOwner(group, ctx);
        return new GroupView(
                group.getId(),
                group.getName(),
                group.getDescription(),
                group.isShared(),
                owner ? GroupAccess.OWNED : GroupAccess.SHARED,
                owner ? ctx.email() : group.getOwner().getEmail(),
                membershipRepository.countByGroup_Id(group.getId())
        );
    }

    private static boolean isOwner(ContactGroup group, OrganizerContext ctx) {
        return group.getOwner().getId().equals(ctx.organizerId());
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Group name is required");
        }
        return name.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
