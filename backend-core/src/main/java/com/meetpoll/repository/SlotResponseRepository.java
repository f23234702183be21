package com.meetpoll.repository;

import com.meetpoll.domain.model.SlotResponse;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SlotResponseRepository extends JpaRepository<SlotResponse, UUID> {
    Optional<SlotResponse> findByMeeting_IdAndContact_IdAndSlot_Id(UUID meetingId, UUID contactId, UUID slotId);

    List<SlotResponse> findByMeeting_Id(UUID meetingId);

    List<SlotResponse> findByMeeting_IdAndContact_Id(UUID meetingId, UUID contactId);

    long countBySlot_Id(UUID slotId);

    @Modifying
    @Query("delete from SlotResponse r where r.slot.id = :slotId")
    int deleteBySlotId(@Param("slotId") UUID slotId);

    @Modifying
    @Query("delete from SlotResponse r where r.meeting.id = :meetingId")
    int deleteByMeetingId(@Param("meetingId") UUID meetingId);
}
