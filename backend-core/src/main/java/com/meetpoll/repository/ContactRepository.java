package com.meetpoll.repository;

import com.meetpoll.domain.model.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ContactRepository extends JpaRepository<Contact, UUID> {
    Optional<Contact> findByOwner_IdAndEmail(UUID ownerId, String email);

    List<Contact> findByOwner_IdOrderByNameAsc(UUID ownerId);

    /**
     * Number of memberships that put the contact into a group currently shared with the grantee.
     */
    @Query("""
            select count(gm) from GroupMembership gm
            join GroupShare gs on gs.group = gm.group
            where gm.contact.id = :contactId
              and gs.granteeEmail = :granteeEmail
              and gm.group.shared = true
            """)
    long countSharedMemberships(@Param("contactId") UUID contactId, @Param("granteeEmail") String granteeEmail);
}
