package com.meetpoll.repository;

import com.meetpoll.domain.enums.MeetingStatus;
import com.meetpoll.domain.model.Meeting;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MeetingRepository extends JpaRepository<Meeting, UUID> {
    List<Meeting> findByOrganizer_IdOrderByCreatedAtDesc(UUID organizerId);

    /**
     * Loads the meeting under a shared row lock so a response write and a finalize/cancel
     * cannot interleave; concurrent responders do not block each other.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select m from Meeting m where m.id = :meetingId")
    Optional<Meeting> findForResponse(@Param("meetingId") UUID meetingId);

    /**
     * Compare-and-set on the status column. Returns the number of rows moved, 0 when the
     * meeting was not in one of the expected states.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Meeting m set m.status = :target
            where m.id = :meetingId and m.status in :expected
            """)
    int transition(@Param("meetingId") UUID meetingId,
                   @Param("expected") Collection<MeetingStatus> expected,
                   @Param("target") MeetingStatus target);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Meeting m set m.status = com.meetpoll.domain.enums.MeetingStatus.FINALIZED,
                                 m.finalizedSlot = :finalizedSlot
            where m.id = :meetingId
              and m.status = com.meetpoll.domain.enums.MeetingStatus.SENT
              and m.finalizedSlot is null
            """)
    int finalizeIfSent(@Param("meetingId") UUID meetingId, @Param("finalizedSlot") String finalizedSlot);
}
