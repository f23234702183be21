package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.notification.MailNotifier;
import com.meetpoll.service.MailSettingsService;
import com.meetpoll.service.MailSettingsUpdate;
import com.meetpoll.service.OrganizerSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * The signed-in organizer's own SMTP account.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/mail-settings")
public class MailSettingsController {

    private final OrganizerSessionService sessionService;
    private final MailSettingsService mailSettingsService;

    @GetMapping
    public ResponseEntity<?> get(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return mailSettingsService.getSettings(ctx.get())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping
    public ResponseEntity<?> save(
            @RequestBody MailSettingsRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(mailSettingsService.saveSettings(ctx.get(), request.toUpdate()));
    }

    @DeleteMapping
    public ResponseEntity<?> clear(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        mailSettingsService.clearSettings(ctx.get());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/test")
    public ResponseEntity<?> sendTest(
            @RequestBody(required = false) MailSettingsRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        MailNotifier.TestMailResult result =
                mailSettingsService.sendTestEmail(ctx.get(), request == null ? null : request.toUpdate());
        return ResponseEntity.status(result.sent() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(result);
    }

    public record MailSettingsRequest(
            String host,
            Integer port,
            String username,
            String password,
            String fromAddress,
            String fromName,
            Boolean startTls
    ) {
        MailSettingsUpdate toUpdate() {
            return new MailSettingsUpdate(host, port, username, password, fromAddress, fromName, startTls);
        }

        @Override
        public String toString() {
            return "MailSettingsRequest[host=" + host + ", port=" + port + ", username=" + username + "]";
        }
    }
}
