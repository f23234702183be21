package com.meetpoll.controller;

import com.meetpoll.domain.enums.Availability;
import com.meetpoll.service.ResponseCollectorService;
import com.meetpoll.service.ResponseCollectorService.AlternativeTime;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Token-authenticated endpoints behind the link participants receive by mail.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/respond")
public class ParticipantResponseController {

    private final ResponseCollectorService responseCollectorService;

    @GetMapping
    public ResponseEntity<?> view(@RequestParam(value = "token", required = false) String token) {
        return ResponseEntity.ok(responseCollectorService.viewInvitation(token));
    }

    @PostMapping
    public ResponseEntity<?> submit(@RequestParam(value = "token", required = false) String token, @RequestBody SubmitRequest request) {
        AlternativeTime alternative = request.suggestion() == null
                ? null
                : new AlternativeTime(request.suggestion().suggestedAt(), request.suggestion().note());
        return ResponseEntity.ok(responseCollectorService.submitAll(token, request.answers(), alternative));
    }

    @PutMapping("/slots/{slotId}")
    public ResponseEntity<?> answer(
            @RequestParam(value = "token", required = false) String token,
            @PathVariable("slotId") UUID slotId,
            @RequestBody AnswerRequest request
    ) {
        return ResponseEntity.ok(responseCollectorService.submitResponse(token, slotId, request.availability()));
    }

    @PostMapping("/suggestion")
    public ResponseEntity<?> suggest(@RequestParam(value = "token", required = false) String token, @RequestBody SuggestionRequest request) {
        return ResponseEntity.ok(responseCollectorService.suggestAlternative(token, request.suggestedAt(), request.note()));
    }

    public record SubmitRequest(Map<UUID, Availability> answers, SuggestionRequest suggestion) {
    }

    public record AnswerRequest(Availability availability) {
    }

    public record SuggestionRequest(Instant suggestedAt, String note) {
    }
}
