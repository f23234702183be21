package com.meetpoll.service;

import com.meetpoll.domain.enums.CoverageLevel;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregated answers for one slot. {@code pending} counts invited participants without an
 * answer for this slot; {@code coverage} is the share of invited participants who can attend
 * (available or maybe).
 */
public record RankedSlot(
        UUID slotId,
        Instant startsAt,
        int durationMinutes,
        String label,
        int available,
        int maybe,
        int unavailable,
        int pending,
        double score,
        double coverage,
        CoverageLevel coverageLevel
) {
}
