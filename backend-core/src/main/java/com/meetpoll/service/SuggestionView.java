package com.meetpoll.service;

import java.time.Instant;
import java.util.UUID;

public record SuggestionView(UUID contactId, String participantName, Instant suggestedAt, String label, String note) {
}
