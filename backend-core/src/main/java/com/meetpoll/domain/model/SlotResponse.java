package com.meetpoll.domain.model;

import com.meetpoll.domain.enums.Availability;
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
@Table(name = "slot_responses", uniqueConstraints = {
        @UniqueConstraint(name = "uk_slot_responses", columnNames = {"meeting_id", "contact_id", "slot_id"})
}, indexes = {
        @Index(name = "idx_slot_responses_slot", columnList = "slot_id")
})
public class SlotResponse extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "meeting_id", nullable = false, updatable = false)
    private Meeting meeting;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id", nullable = false, updatable = false)
    private Contact contact;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "slot_id", nullable = false, updatable = false)
    private TimeSlot slot;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Availability availability;

    @Column(name = "answered_at", nullable = false)
    private OffsetDateTime answeredAt;
}
