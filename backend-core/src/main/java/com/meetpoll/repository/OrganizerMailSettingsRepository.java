package com.meetpoll.repository;

import com.meetpoll.domain.model.OrganizerMailSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface OrganizerMailSettingsRepository extends JpaRepository<OrganizerMailSettings, UUID> {
    Optional<OrganizerMailSettings> findByOrganizer_Id(UUID organizerId);

    Optional<OrganizerMailSettings> findByOrganizer_Email(String email);

    @Modifying
    @Query("delete from OrganizerMailSettings s where s.organizer.id = :organizerId")
    int deleteByOrganizerId(@Param("organizerId") UUID organizerId);
}
