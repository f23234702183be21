package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.service.OrganizerAuthService;
import com.meetpoll.service.OrganizerAuthService.PasswordResetResult;
import com.meetpoll.service.OrganizerAuthService.RegistrationResult;
import com.meetpoll.service.OrganizerSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final OrganizerAuthService organizerAuthService;
    private final OrganizerSessionService sessionService;

    @PostMapping("/register")
    public ResponseEntity<?> register(@RequestBody RegisterRequest request) {
        RegistrationResult result = organizerAuthService.register(
                request.email(), request.password(), request.displayName(), request.recoveryPhrase());
        if (!result.isCreated()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("An account with this email already exists");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(result.organizerId()));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody LoginRequest request) {
        Optional<UUID> organizerId = organizerAuthService.authenticate(request.email(), request.password());
        if (organizerId.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Invalid email or password");
        }
        OrganizerSessionService.IssuedSession session = sessionService.issue(organizerId.get());
        return ResponseEntity.ok(new LoginResponse(organizerId.get(), session.session(), session.expiresAt()));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<?> resetPassword(@RequestBody ResetPasswordRequest request) {
        PasswordResetResult result = organizerAuthService.resetPassword(
                request.email(), request.recoveryPhrase(), request.newPassword());
        return switch (result) {
            case OK -> ResponseEntity.noContent().build();
            case INVALID_RECOVERY_PHRASE -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Invalid recovery phrase");
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Account not found");
        };
    }

    @GetMapping("/me")
    public ResponseEntity<?> me(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return organizerAuthService.findProfile(ctx.get().organizerId())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized"));
    }

    public record RegisterRequest(String email, String password, String displayName, String recoveryPhrase) {
    }

    public record RegisterResponse(UUID organizerId) {
    }

    public record LoginRequest(String email, String password) {
    }

    public record LoginResponse(UUID organizerId, String session, Instant expiresAt) {
    }

    public record ResetPasswordRequest(String email, String recoveryPhrase, String newPassword) {
    }
}
