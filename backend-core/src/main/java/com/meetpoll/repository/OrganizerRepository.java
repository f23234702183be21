package com.meetpoll.repository;

import com.meetpoll.domain.model.Organizer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OrganizerRepository extends JpaRepository<Organizer, UUID> {
    Optional<Organizer> findByEmail(String email);

    boolean existsByEmail(String email);
}
