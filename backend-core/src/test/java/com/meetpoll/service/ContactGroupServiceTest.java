package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.GroupAccess;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.ContactGroup;
import com.meetpoll.domain.model.GroupMembership;
import com.meetpoll.domain.model.GroupShare;
import com.meetpoll.domain.model.Organizer;
import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.ForbiddenException;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.repository.ContactGroupRepository;
import com.meetpoll.repository.ContactRepository;
import com.meetpoll.repository.GroupMembershipRepository;
import com.meetpoll.repository.GroupShareRepository;
import com.meetpoll.repository.OrganizerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContactGroupServiceTest {

    @Mock
    private ContactGroupRepository groupRepository;

    @Mock
    private GroupMembershipRepository membershipRepository;

    @Mock
    private GroupShareRepository shareRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private OrganizerRepository organizerRepository;

    private ContactGroupService groupService;
    private Organizer owner;
    private Organizer grantee;
    private OrganizerContext ownerCtx;
    private OrganizerContext granteeCtx;
    private ContactGroup group;
    private Contact alice;

    @BeforeEach
    void setUp() {
        groupService = new ContactGroupService(groupRepository, membershipRepository, shareRepository,
                contactRepository, organizerRepository, Fixtures.storage());
        owner = Fixtures.organizer("owner@example.com");
        grantee = Fixtures.organizer("friend@example.com");
        ownerCtx = Fixtures.context(owner);
        granteeCtx = Fixtures.context(grantee);
        group = Fixtures.group(owner, "Team");
        alice = Fixtures.contact(owner, "Alice", "alice@example.com");
    }

    @Test
    void grantShare_shouldMarkGroupSharedAndStoreCanonicalEmail() {
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(false);

        groupService.grantShare(ownerCtx, group.getId(), "  Friend@Example.COM ");

        assertTrue(group.isShared());
        ArgumentCaptor<GroupShare> share = ArgumentCaptor.forClass(GroupShare.class);
        verify(shareRepository).saveAndFlush(share.capture());
        assertEquals("friend@example.com", share.getValue().getGranteeEmail());
    }

    @Test
    void grantShare_shouldRejectSelfShare() {
        assertThrows(InvalidArgumentException.class,
                () -> groupService.grantShare(ownerCtx, group.getId(), "OWNER@example.com"));
        verify(shareRepository, never()).saveAndFlush(any());
    }

    @Test
    void grantShare_shouldRejectDuplicateGrant() {
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(true);

        assertThrows(ConflictException.class,
                () -> groupService.grantShare(ownerCtx, group.getId(), "friend@example.com"));
    }

    @Test
    void listMembers_shouldAllowLiveGrantee() {
        group.setShared(true);
        GroupMembership membership = new GroupMembership();
        membership.setGroup(group);
        membership.setContact(alice);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(true);
        when(membershipRepository.findByGroup_IdOrderByContact_NameAsc(group.getId())).thenReturn(List.of(membership));

        List<ContactView> members = groupService.listMembers(granteeCtx, group.getId());

        assertEquals(List.of(new ContactView(alice.getId(), "Alice", "alice@example.com")), members);
    }

    @Test
    void addMember_shouldForbidGrantee() {
        group.setShared(true);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(true);

        assertThrows(ForbiddenException.class, () -> groupService.addMember(granteeCtx, group.getId(), alice.getId()));
        verify(membershipRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateGroup_shouldForbidGrantee() {
        group.setShared(true);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(true);

        assertThrows(ForbiddenException.class,
                () -> groupService.updateGroup(granteeCtx, group.getId(), "Renamed", null));
        assertEquals("Team", group.getName());
        verify(groupRepository, never()).saveAndFlush(any());
    }

    @Test
    void deleteGroup_shouldForbidGrantee() {
        group.setShared(true);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(shareRepository.existsByGroup_IdAndGranteeEmail(group.getId(), "friend@example.com")).thenReturn(true);

        assertThrows(ForbiddenException.class, () -> groupService.deleteGroup(granteeCtx, group.getId()));
        verify(membershipRepository, never()).deleteByGroupId(any());
        verify(shareRepository, never()).deleteByGroupId(any());
        verify(groupRepository, never()).delete(any());
    }

    @Test
    void listMembers_shouldHideUnsharedGroupFromFormerGrantee() {
        group.setShared(false);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));

        assertThrows(NotFoundException.class, () -> groupService.listMembers(granteeCtx, group.getId()));
    }

    @Test
    void addMember_shouldRejectDuplicateMembership() {
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(contactRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(membershipRepository.existsByGroup_IdAndContact_Id(group.getId(), alice.getId())).thenReturn(true);

        assertThrows(ConflictException.class, () -> groupService.addMember(ownerCtx, group.getId(), alice.getId()));
    }

    @Test
    void addMember_shouldRejectContactOfAnotherOrganizer() {
        Contact foreign = Fixtures.contact(grantee, "Zed", "zed@example.com");
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(contactRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(ForbiddenException.class, () -> groupService.addMember(ownerCtx, group.getId(), foreign.getId()));
    }

    @Test
    void setShared_shouldRevokeAllGrantsWhenTurnedOff() {
        group.setShared(true);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));
        when(groupRepository.saveAndFlush(group)).thenReturn(group);
        when(shareRepository.deleteByGroupId(group.getId())).thenReturn(2);

        GroupView view = groupService.setShared(ownerCtx, group.getId(), false);

        assertFalse(view.shared());
        verify(shareRepository).deleteByGroupId(group.getId());
    }

    @Test
    void listGroups_shouldReturnOwnedThenShared() {
        ContactGroup mine = Fixtures.group(grantee, "Mine");
        group.setShared(true);
        when(groupRepository.findByOwner_IdOrderByNameAsc(grantee.getId())).thenReturn(List.of(mine));
        when(groupRepository.findSharedWith("friend@example.com")).thenReturn(List.of(group));
        when(membershipRepository.countByGroup_Id(mine.getId())).thenReturn(0L);
        when(membershipRepository.countByGroup_Id(group.getId())).thenReturn(3L);

        List<GroupView> groups = groupService.listGroups(granteeCtx);

        assertEquals(2, groups.size());
        assertEquals(GroupAccess.OWNED, groups.get(0).access());
        assertEquals(GroupAccess.SHARED, groups.get(1).access());
        assertEquals("owner@example.com", groups.get(1).ownerEmail());
        assertEquals(3, groups.get(1).memberCount());
    }

    @Test
    void deleteGroup_shouldRemoveMembershipsAndShares() {
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));

        groupService.deleteGroup(ownerCtx, group.getId());

        verify(membershipRepository).deleteByGroupId(group.getId());
        verify(shareRepository).deleteByGroupId(group.getId());
        verify(groupRepository).delete(group);
    }
}
