package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.model.Organizer;
import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.repository.OrganizerRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Organizer accounts: registration, password login and password reset through a recovery phrase.
 * Hashing runs outside the storage transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizerAuthService {

    static final int MIN_PASSWORD_LENGTH = 8;

    private final OrganizerRepository organizerRepository;
    private final PasswordEncoder passwordEncoder;
    private final StorageTransactions storage;

    public RegistrationResult register(String email, String password, String displayName, String recoveryPhrase) {
        String canonical = requireEmail(email);
        requirePassword(password);
        if (recoveryPhrase == null || recoveryPhrase.isBlank()) {
            throw new InvalidArgumentException("Recovery phrase is required");
        }
        String name = displayName == null || displayName.isBlank()
                ? EmailAddresses.localPart(canonical)
                : displayName.trim();
        String passwordHash = passwordEncoder.encode(password);
        String recoveryHash = passwordEncoder.encode(normalizePhrase(recoveryPhrase));

        try {
            UUID id = storage.write(() -> {
                if (organizerRepository.existsByEmail(canonical)) {
                    return null;
                }
                Organizer organizer = new Organizer();
                organizer.setEmail(canonical);
                organizer.setDisplayName(name);
                organizer.setPasswordHash(passwordHash);
                organizer.setRecoveryHash(recoveryHash);
                return organizerRepository.saveAndFlush(organizer).getId();
            });
            if (id == null) {
                return RegistrationResult.alreadyExists();
            }
            log.info("Registered organizer {}", canonical);
            return RegistrationResult.created(id);
        } catch (ConflictException e) {
            return RegistrationResult.alreadyExists();
        }
    }

    public Optional<UUID> authenticate(String email, String password) {
        if (!EmailAddresses.looksValid(email) || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        String canonical = EmailAddresses.canonical(email);
        Optional<Credentials> credentials = storage.read(() -> organizerRepository.findByEmail(canonical)
                .map(o -> new Credentials(o.getId(), o.getPasswordHash(), o.getRecoveryHash())));
        if (credentials.isEmpty()) {
            log.debug("Login attempt for unknown organizer {}", canonical);
            return Optional.empty();
        }
        if (!passwordEncoder.matches(password, credentials.get().passwordHash())) {
            log.info("Rejected login for {}", canonical);
            return Optional.empty();
        }
        return Optional.of(credentials.get().id());
    }

    public PasswordResetResult resetPassword(String email, String recoveryPhrase, String newPassword) {
        requirePassword(newPassword);
        if (!EmailAddresses.looksValid(email)) {
            return PasswordResetResult.NOT_FOUND;
        }
        String canonical = EmailAddresses.canonical(email);
        Optional<Credentials> credentials = storage.read(() -> organizerRepository.findByEmail(canonical)
                .map(o -> new Credentials(o.getId(), o.getPasswordHash(), o.getRecoveryHash())));
        if (credentials.isEmpty()) {
            return PasswordResetResult.NOT_FOUND;
        }
        if (recoveryPhrase == null
                || !passwordEncoder.matches(normalizePhrase(recoveryPhrase), credentials.get().recoveryHash())) {
            log.info("Rejected password reset for {}", canonical);
            return PasswordResetResult.INVALID_RECOVERY_PHRASE;
        }

        String newHash = passwordEncoder.encode(newPassword);
        boolean updated = storage.write(() -> organizerRepository.findById(credentials.get().id())
                .map(organizer -> {
                    organizer.setPasswordHash(newHash);
                    return true;
                })
                .orElse(false));
        if (!updated) {
            return PasswordResetResult.NOT_FOUND;
        }
        log.info("Password reset for {}", canonical);
        return PasswordResetResult.OK;
    }

    /**
     * Rebuilds the caller context for a session that was issued earlier; empty when the account is gone.
     */
    public Optional<OrganizerContext> loadContext(UUID organizerId) {
        if (organizerId == null) {
            return Optional.empty();
        }
        return storage.read(() -> organizerRepository.findById(organizerId)
                .map(o -> new OrganizerContext(o.getId(), o.getEmail())));
    }

    public Optional<OrganizerProfile> findProfile(UUID organizerId) {
        return storage.read(() -> organizerRepository.findById(organizerId)
                .map(o -> new OrganizerProfile(o.getId(), o.getEmail(), o.getDisplayName())));
    }

    private String requireEmail(String email) {
        if (!EmailAddresses.looksValid(email)) {
            throw new InvalidArgumentException("Invalid email address: %s", email);
        }
        return EmailAddresses.canonical(email);
    }

    private void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new InvalidArgumentException("Password must be at least %d characters", MIN_PASSWORD_LENGTH);
        }
    }

    private static String normalizePhrase(String phrase) {
        return phrase.trim();
    }

    private record Credentials(UUID id, String passwordHash, String recoveryHash) {
    }

    public record OrganizerProfile(UUID id, String email, String displayName) {
    }

    public enum PasswordResetResult {
        OK,
        INVALID_RECOVERY_PHRASE,
        NOT_FOUND
    }

    public record RegistrationResult(Status status, UUID organizerId) {

        public enum Status {
            CREATED,
            ALREADY_EXISTS
        }

        static RegistrationResult created(UUID organizerId) {
            return new RegistrationResult(Status.CREATED, organizerId);
        }

        static RegistrationResult alreadyExists() {
            return new RegistrationResult(Status.ALREADY_EXISTS, null);
        }

        public boolean isCreated() {
            return status == Status.CREATED;
        }
    }
}
