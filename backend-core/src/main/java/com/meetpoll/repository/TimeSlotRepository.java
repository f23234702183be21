package com.meetpoll.repository;

import com.meetpoll.domain.model.TimeSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TimeSlotRepository extends JpaRepository<TimeSlot, UUID> {
    List<TimeSlot> findByMeeting_IdOrderByStartsAtAsc(UUID meetingId);

    Optional<TimeSlot> findByIdAndMeeting_Id(UUID slotId, UUID meetingId);

    long countByMeeting_Id(UUID meetingId);

    @Modifying
    @Query("delete from TimeSlot s where s.meeting.id = :meetingId")
    int deleteByMeetingId(@Param("meetingId") UUID meetingId);
}
