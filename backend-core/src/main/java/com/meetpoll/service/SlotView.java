package com.meetpoll.service;

import java.time.Instant;
import java.util.UUID;

public record SlotView(UUID id, Instant startsAt, int durationMinutes, String label) {
}
