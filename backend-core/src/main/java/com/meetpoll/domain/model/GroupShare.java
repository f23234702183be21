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
@Table(name = "group_shares", uniqueConstraints = {
        @UniqueConstraint(name = "uk_group_shares", columnNames = {"group_id", "grantee_email"})
}, indexes = {
        @Index(name = "idx_group_shares_grantee", columnList = "grantee_email")
})
public class GroupShare extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id", nullable = false)
    private ContactGroup group;

    @Column(name = "grantee_email", nullable = false, length = 320)
    private String granteeEmail;
}
