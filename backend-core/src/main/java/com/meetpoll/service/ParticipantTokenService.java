package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.domain.model.Contact;
import com.meetpoll.domain.model.Meeting;
import com.meetpoll.domain.model.ParticipantBinding;
import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.repository.ContactRepository;
import com.meetpoll.repository.MeetingRepository;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.storage.StorageTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Opaque per-participant response tokens. A token is the only credential a participant holds:
 * random, URL-safe, and bound to exactly one (meeting, contact) pair for the pair's lifetime.
 */
@Slf4j
@Service
public class ParticipantTokenService {

    private static final int MAX_TOKEN_RETRY = 5;

    private final ParticipantBindingRepository bindingRepository;
    private final MeetingRepository meetingRepository;
    private final ContactRepository contactRepository;
    private final StorageTransactions storage;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private final int tokenBytes;

    public ParticipantTokenService(ParticipantBindingRepository bindingRepository,
                                   MeetingRepository meetingRepository,
                                   ContactRepository contactRepository,
                                   StorageTransactions storage,
                                   MeetPollProperties properties) {
        this.bindingRepository = bindingRepository;
        this.meetingRepository = meetingRepository;
        this.contactRepository = contactRepository;
        this.storage = storage;
        this.tokenBytes = properties.safeTokenBytes();
    }

    /**
     * Returns the token for the pair, creating the binding on first use. Safe to call concurrently:
     * the loser of an insert race re-reads and returns the winner's token.
     */
    public String issueToken(UUID meetingId, UUID contactId) {
        return storage.writeWithRetry(() -> bindingFor(
                meetingRepository.findById(meetingId)
                        .orElseThrow(() -> new NotFoundException("Meeting %s not found", meetingId)),
                contactRepository.findById(contactId)
                        .orElseThrow(() -> new NotFoundException("Contact %s not found", contactId))
        ).getToken());
    }

    public Optional<TokenBinding> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return storage.read(() -> bindingRepository.findByToken(token.trim())
                .map(b -> new TokenBinding(b.getMeeting().getId(), b.getContact().getId())));
    }

    /**
     * Existing binding for the pair or a new one with a fresh token. Joins the caller's transaction.
     */
    ParticipantBinding bindingFor(Meeting meeting, Contact contact) {
        Optional<ParticipantBinding> existing =
                bindingRepository.findByMeeting_IdAndContact_Id(meeting.getId(), contact.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        ParticipantBinding binding = new ParticipantBinding();
        binding.setMeeting(meeting);
        binding.setContact(contact);
        binding.setToken(newUniqueToken());
        return bindingRepository.saveAndFlush(binding);
    }

    String newToken() {
        byte[] bytes = new byte[tokenBytes];
        secureRandom.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }

    private String newUniqueToken() {
        for (int attempt = 0; attempt < MAX_TOKEN_RETRY; attempt++) {
            String candidate = newToken();
            if (bindingRepository.findByToken(candidate).isEmpty()) {
                return candidate;
            }
            log.warn("Response token collision, regenerating");
        }
        throw new ConflictException("Could not generate a unique response token");
    }

    public record TokenBinding(UUID meetingId, UUID contactId) {
    }
}
