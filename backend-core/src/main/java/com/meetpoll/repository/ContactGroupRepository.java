package com.meetpoll.repository;

import com.meetpoll.domain.model.ContactGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ContactGroupRepository extends JpaRepository<ContactGroup, UUID> {
    List<ContactGroup> findByOwner_IdOrderByNameAsc(UUID ownerId);

    @Query("""
            select g from ContactGroup g
            join GroupShare gs on gs.group = g
            where gs.granteeEmail = :granteeEmail and g.shared = true
            order by g.name asc
            """)
    List<ContactGroup> findSharedWith(@Param("granteeEmail") String granteeEmail);

    @Query("""
            select g from ContactGroup g
            join GroupMembership gm on gm.group = g
            where gm.contact.id = :contactId
            order by g.name asc
            """)
    List<ContactGroup> findByMember(@Param("contactId") UUID contactId);
}
