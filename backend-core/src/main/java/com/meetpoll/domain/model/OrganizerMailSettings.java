package com.meetpoll.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * SMTP account an organizer sends through. Blank columns fall back to the application-wide mail setup.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "organizer_mail_settings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_organizer_mail_settings", columnNames = {"organizer_id"})
})
public class OrganizerMailSettings extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organizer_id", nullable = false)
    private Organizer organizer;

    @Column(name = "smtp_host", nullable = false)
    private String host;

    @Column(name = "smtp_port", nullable = false)
    private int port;

    @Column(name = "smtp_username", length = 320)
    private String username;

    @Column(name = "smtp_password", length = 512)
    private String password;

    @Column(name = "from_address", length = 320)
    private String fromAddress;

    @Column(name = "from_name")
    private String fromName;

    @Column(name = "start_tls", nullable = false)
    private boolean startTls = true;
}
