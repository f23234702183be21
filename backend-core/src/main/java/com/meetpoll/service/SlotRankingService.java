package com.meetpoll.service;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.enums.CoverageLevel;
import com.meetpoll.domain.model.SlotResponse;
import com.meetpoll.domain.model.TimeSlot;
import com.meetpoll.repository.ParticipantBindingRepository;
import com.meetpoll.repository.SlotResponseRepository;
import com.meetpoll.repository.TimeSlotRepository;
import com.meetpoll.scoring.SlotScoringPolicy;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.SlotFormats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SlotRankingService {

    private static final Comparator<RankedSlot> BEST_FIRST = Comparator
            .comparingDouble(RankedSlot::score).reversed()
            .thenComparing(RankedSlot::startsAt)
            .thenComparing(RankedSlot::slotId);

    private final TimeSlotRepository slotRepository;
    private final SlotResponseRepository responseRepository;
    private final ParticipantBindingRepository bindingRepository;
    private final MeetingLookup meetingLookup;
    private final SlotScoringPolicy scoringPolicy;
    private final MeetPollProperties properties;
    private final StorageTransactions storage;

    public List<RankedSlot> rankSlots(OrganizerContext ctx, UUID meetingId) {
        return storage.read(() -> {
            meetingLookup.requireOwned(ctx, meetingId);
            return rank(
                    slotRepository.findByMeeting_IdOrderByStartsAtAsc(meetingId),
                    responseRepository.findByMeeting_Id(meetingId),
                    (int) bindingRepository.countByMeeting_Id(meetingId)
            );
        });
    }

    /**
     * Ranks slots by score, then earlier start, then slot id. Every slot of the meeting is
     * returned, with zero counts when nobody answered it.
     */
    public List<RankedSlot> rank(List<TimeSlot> slots, Collection<SlotResponse> responses, int invited) {
        Map<UUID, int[]> counts = new HashMap<>();
        for (SlotResponse response : responses) {
            int[] tally = counts.computeIfAbsent(response.getSlot().getId(), id -> new int[3]);
            switch (response.getAvailability()) {
                case AVAILABLE -> tally[0]++;
                case MAYBE -> tally[1]++;
                case UNAVAILABLE -> tally[2]++;
            }
        }

        ZoneId zone = properties.safeZone();
        return slots.stream()
                .map(slot -> {
                    int[] tally = counts.getOrDefault(slot.getId(), new int[3]);
                    int available = tally[0];
                    int maybe = tally[1];
                    int unavailable = tally[2];
                    int pending = Math.max(0, invited - available - maybe - unavailable);
                    double coverage = invited == 0 ? 0.0 : (double) (available + maybe) / invited;
                    return new RankedSlot(
                            slot.getId(),
                            slot.getStartsAt(),
                            slot.getDurationMinutes(),
                            SlotFormats.withDuration(slot.getStartsAt(), slot.getDurationMinutes(), zone),
                            available,
                            maybe,
                            unavailable,
                            pending,
                            scoringPolicy.score(available, maybe, unavailable),
                            coverage,
                            CoverageLevel.of(available, maybe, invited)
                    );
                })
                .sorted(BEST_FIRST)
                .toList();
    }
}
