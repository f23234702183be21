package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.service.ContactService;
import com.meetpoll.service.ContactService.ContactDeletion;
import com.meetpoll.service.OrganizerSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/contacts")
public class ContactController {

    private final OrganizerSessionService sessionService;
    private final ContactService contactService;

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(contactService.listContacts(ctx.get()));
    }

    @PostMapping
    public ResponseEntity<?> create(
            @RequestBody ContactRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(contactService.createContact(ctx.get(), request.name(), request.email()));
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
        return ResponseEntity.ok(contactService.getContact(ctx.get(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(
            @PathVariable("id") UUID id,
            @RequestBody ContactRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(contactService.updateContact(ctx.get(), id, request.name(), request.email()));
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
        ContactDeletion deletion = contactService.deleteContact(ctx.get(), id);
        if (!deletion.removed()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(deletion);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/groups")
    public ResponseEntity<?> groups(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(contactService.getContactGroups(ctx.get(), id));
    }

    @GetMapping("/{id}/meetings")
    public ResponseEntity<?> meetings(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(contactService.contactInUse(ctx.get(), id));
    }

    public record ContactRequest(String name, String email) {
    }
}
