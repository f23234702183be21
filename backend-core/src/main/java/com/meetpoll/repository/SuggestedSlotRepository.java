package com.meetpoll.repository;

import com.meetpoll.domain.model.SuggestedSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SuggestedSlotRepository extends JpaRepository<SuggestedSlot, UUID> {
    List<SuggestedSlot> findByMeeting_IdOrderBySuggestedAtAsc(UUID meetingId);

    Optional<SuggestedSlot> findByMeeting_IdAndContact_Id(UUID meetingId, UUID contactId);

    @Modifying(flushAutomatically = true)
    @Query("delete from SuggestedSlot s where s.meeting.id = :meetingId and s.contact.id = :contactId")
    int deleteSuggestion(@Param("meetingId") UUID meetingId, @Param("contactId") UUID contactId);

    @Modifying
    @Query("delete from SuggestedSlot s where s.meeting.id = :meetingId")
    int deleteByMeetingId(@Param("meetingId") UUID meetingId);
}
