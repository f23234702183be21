package com.meetpoll.domain.model;

import com.meetpoll.domain.enums.MeetingStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@DynamicUpdate
@Table(name = "meetings", indexes = {
        @Index(name = "idx_meetings_organizer", columnList = "organizer_id")
})
public class Meeting extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organizer_id", nullable = false)
    private Organizer organizer;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MeetingStatus status = MeetingStatus.DRAFT;

    /**
     * Rendered start of the chosen slot. Status and this column change only through the
     * conditional updates in {@code MeetingRepository}.
     */
    @Column(name = "finalized_slot")
    private String finalizedSlot;
}
