package com.meetpoll.service;

import com.meetpoll.config.SessionProperties;
import com.meetpoll.context.OrganizerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Stateless organizer sessions carried in the {@code X-Organizer-Session} header as
 * {@code organizerId.expiresAtEpochSecond.signature}, signed with HMAC-SHA256.
 */
@Slf4j
@Service
public class OrganizerSessionService {

    public static final String HEADER = "X-Organizer-Session";

    private final OrganizerAuthService organizerAuthService;
    private final SessionProperties properties;
    private final byte[] secretKey;

    public OrganizerSessionService(OrganizerAuthService organizerAuthService, SessionProperties properties) {
        this.organizerAuthService = organizerAuthService;
        this.properties = properties;
        if (properties.hasSecret()) {
            this.secretKey = properties.secret().getBytes(StandardCharsets.UTF_8);
        } else {
            log.warn("meetpoll.session.secret is not set, sessions will not survive a restart");
            this.secretKey = new byte[32];
            new SecureRandom().nextBytes(this.secretKey);
        }
    }

    public IssuedSession issue(UUID organizerId) {
        Instant expiresAt = Instant.now().plus(properties.safeTtl());
        String payload = organizerId + "." + expiresAt.getEpochSecond();
        return new IssuedSession(payload + "." + sign(payload), expiresAt);
    }

    public Optional<OrganizerContext> resolve(String session) {
        if (session == null || session.isBlank()) {
            return Optional.empty();
        }
        String[] parts = session.trim().split("\\.");
        if (parts.length != 3) {
            return Optional.empty();
        }
        String payload = parts[0] + "." + parts[1];
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.warn("Organizer session signature mismatch");
            return Optional.empty();
        }
        try {
            UUID organizerId = UUID.fromString(parts[0]);
            long expiresAt = Long.parseLong(parts[1]);
            if (Instant.now().getEpochSecond() >= expiresAt) {
                return Optional.empty();
            }
            return organizerAuthService.loadContext(organizerId);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed organizer session: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String sign(String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey, "HmacSHA256"));
            byte[] result = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(result);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    public record IssuedSession(String session, Instant expiresAt) {
    }
}
