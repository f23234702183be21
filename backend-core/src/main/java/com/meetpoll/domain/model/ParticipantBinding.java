package com.meetpoll.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "meeting_participants", uniqueConstraints = {
        @UniqueConstraint(name = "uk_participants_meeting_contact", columnNames = {"meeting_id", "contact_id"}),
        @UniqueConstraint(name = "uk_participants_token", columnNames = {"token"})
})
public class ParticipantBinding extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "meeting_id", nullable = false, updatable = false)
    private Meeting meeting;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id", nullable = false, updatable = false)
    private Contact contact;

    @Column(nullable = false, updatable = false, length = 64)
    private String token;

    @Column(nullable = false)
    private boolean responded = false;

    @Column(name = "responded_at")
    private OffsetDateTime respondedAt;
}
