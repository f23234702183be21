package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.service.MeetingDraft;
import com.meetpoll.service.MeetingFinalizationService;
import com.meetpoll.service.MeetingService;
import com.meetpoll.service.MeetingSummary;
import com.meetpoll.service.OrganizerSessionService;
import com.meetpoll.service.SlotProposal;
import com.meetpoll.service.SlotRankingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/meetings")
public class MeetingController {

    private final OrganizerSessionService sessionService;
    private final MeetingService meetingService;
    private final SlotRankingService slotRankingService;
    private final MeetingFinalizationService finalizationService;

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.listMeetings(ctx.get()));
    }

    /**
     * Creates a draft; with {@code send=true} the invitations go out in the same call.
     */
    @PostMapping
    public ResponseEntity<?> create(
            @RequestBody MeetingCreateRequest request,
            @RequestParam(value = "send", defaultValue = "false") boolean send,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        MeetingDraft draft = request.toDraft();
        if (send) {
            return ResponseEntity.status(HttpStatus.CREATED).body(meetingService.createAndSend(ctx.get(), draft));
        }
        MeetingSummary summary = meetingService.createMeeting(ctx.get(), draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(summary);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.getOverview(ctx.get(), id));
    }

    @GetMapping("/{id}/ranking")
    public ResponseEntity<?> ranking(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(slotRankingService.rankSlots(ctx.get(), id));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<?> send(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.sendInvitations(ctx.get(), id));
    }

    @PostMapping("/{id}/reminders")
    public ResponseEntity<?> remind(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.sendReminders(ctx.get(), id));
    }

    @PostMapping("/{id}/participants")
    public ResponseEntity<?> addParticipants(
            @PathVariable("id") UUID id,
            @RequestBody ParticipantsRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.addParticipants(ctx.get(), id, request.contactIds()));
    }

    @PostMapping("/{id}/slots")
    public ResponseEntity<?> addSlot(
            @PathVariable("id") UUID id,
            @RequestBody SlotRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(meetingService.addSlot(ctx.get(), id, request.toProposal()));
    }

    @DeleteMapping("/{id}/slots/{slotId}")
    public ResponseEntity<?> deleteSlot(
            @PathVariable("id") UUID id,
            @PathVariable("slotId") UUID slotId,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        meetingService.deleteSlot(ctx.get(), id, slotId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/schedule-update")
    public ResponseEntity<?> scheduleUpdate(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(meetingService.notifyScheduleUpdate(ctx.get(), id));
    }

    @PostMapping("/{id}/finalize")
    public ResponseEntity<?> finalizeMeeting(
            @PathVariable("id") UUID id,
            @RequestBody FinalizeRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        if (request.slotId() == null) {
            return ResponseEntity.badRequest().body("slotId is required");
        }
        return ResponseEntity.ok(finalizationService.finalizeMeeting(ctx.get(), id, request.slotId()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        meetingService.cancelMeeting(ctx.get(), id);
        return ResponseEntity.ok(meetingService.getMeeting(ctx.get(), id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        meetingService.deleteMeeting(ctx.get(), id);
        return ResponseEntity.noContent().build();
    }

    public record SlotRequest(Instant startsAt, Integer durationMinutes) {

        SlotProposal toProposal() {
            return new SlotProposal(startsAt, durationMinutes);
        }
    }

    public record MeetingCreateRequest(
            String title,
            String description,
            List<SlotRequest> slots,
            List<UUID> contactIds,
            UUID groupId,
            List<UUID> groupMemberIds
    ) {
        MeetingDraft toDraft() {
            List<SlotProposal> proposals = slots == null
                    ? List.of()
                    : slots.stream().map(slot -> slot == null ? null : slot.toProposal()).toList();
            return new MeetingDraft(title, description, proposals, contactIds, groupId, groupMemberIds);
        }
    }

    public record ParticipantsRequest(List<UUID> contactIds) {
    }

    public record FinalizeRequest(UUID slotId) {
    }
}
