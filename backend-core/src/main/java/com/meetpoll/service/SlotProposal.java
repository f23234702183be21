package com.meetpoll.service;

import java.time.Instant;

/**
 * Proposed slot for a new or existing meeting; {@code durationMinutes} falls back to 60 when absent.
 */
public record SlotProposal(Instant startsAt, Integer durationMinutes) {
}
