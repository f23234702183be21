package com.meetpoll.repository;

import com.meetpoll.domain.model.ParticipantBinding;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ParticipantBindingRepository extends JpaRepository<ParticipantBinding, UUID> {
    Optional<ParticipantBinding> findByToken(String token);

    Optional<ParticipantBinding> findByMeeting_IdAndContact_Id(UUID meetingId, UUID contactId);

    @EntityGraph(attributePaths = "contact")
    List<ParticipantBinding> findByMeeting_IdOrderByContact_NameAsc(UUID meetingId);

    @EntityGraph(attributePaths = "meeting")
    List<ParticipantBinding> findByContact_Id(UUID contactId);

    boolean existsByContact_Id(UUID contactId);

    long countByMeeting_Id(UUID meetingId);

    @Modifying
    @Query("delete from ParticipantBinding b where b.meeting.id = :meetingId")
    int deleteByMeetingId(@Param("meetingId") UUID meetingId);
}
