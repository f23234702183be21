package com.meetpoll.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "contacts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_contacts_owner_email", columnNames = {"owner_id", "email"})
}, indexes = {
        @Index(name = "idx_contacts_owner", columnList = "owner_id")
})
public class Contact extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private Organizer owner;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 320)
    private String email;
}
