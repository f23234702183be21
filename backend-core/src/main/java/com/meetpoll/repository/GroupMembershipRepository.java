package com.meetpoll.repository;

import com.meetpoll.domain.model.GroupMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface GroupMembershipRepository extends JpaRepository<GroupMembership, UUID> {
    List<GroupMembership> findByGroup_IdOrderByContact_NameAsc(UUID groupId);

    long countByGroup_Id(UUID groupId);

    boolean existsByGroup_IdAndContact_Id(UUID groupId, UUID contactId);

    @Modifying
    @Query("delete from GroupMembership gm where gm.group.id = :groupId and gm.contact.id = :contactId")
    int deleteMembership(@Param("groupId") UUID groupId, @Param("contactId") UUID contactId);

    @Modifying
    @Query("delete from GroupMembership gm where gm.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);

    @Modifying
    @Query("delete from GroupMembership gm where gm.contact.id = :contactId")
    int deleteByContactId(@Param("contactId") UUID contactId);
}
