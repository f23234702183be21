package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.service.ContactGroupService;
import com.meetpoll.service.OrganizerSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/groups")
public class GroupController {

    private final OrganizerSessionService sessionService;
    private final ContactGroupService groupService;

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(groupService.listGroups(ctx.get()));
    }

    @PostMapping
    public ResponseEntity<?> create(
            @RequestBody GroupRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(groupService.createGroup(ctx.get(), request.name(), request.description()));
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
        return ResponseEntity.ok(groupService.getGroup(ctx.get(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(
            @PathVariable("id") UUID id,
            @RequestBody GroupRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(groupService.updateGroup(ctx.get(), id, request.name(), request.description()));
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
        groupService.deleteGroup(ctx.get(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/members")
    public ResponseEntity<?> members(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(groupService.listMembers(ctx.get(), id));
    }

    @PutMapping("/{id}/members/{contactId}")
    public ResponseEntity<?> addMember(
            @PathVariable("id") UUID id,
            @PathVariable("contactId") UUID contactId,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        groupService.addMember(ctx.get(), id, contactId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}/members/{contactId}")
    public ResponseEntity<?> removeMember(
            @PathVariable("id") UUID id,
            @PathVariable("contactId") UUID contactId,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        if (!groupService.removeMember(ctx.get(), id, contactId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Contact is not a member of this group");
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/shared")
    public ResponseEntity<?> setShared(
            @PathVariable("id") UUID id,
            @RequestBody SharedRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(groupService.setShared(ctx.get(), id, request.shared()));
    }

    @GetMapping("/{id}/shares")
    public ResponseEntity<?> shares(
            @PathVariable("id") UUID id,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        return ResponseEntity.ok(groupService.listShares(ctx.get(), id));
    }

    @PostMapping("/{id}/shares")
    public ResponseEntity<?> share(
            @PathVariable("id") UUID id,
            @RequestBody ShareRequest request,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        groupService.grantShare(ctx.get(), id, request.email());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}/shares")
    public ResponseEntity<?> unshare(
            @PathVariable("id") UUID id,
            @RequestParam("email") String email,
            @RequestHeader(value = OrganizerSessionService.HEADER, required = false) String session
    ) {
        Optional<OrganizerContext> ctx = sessionService.resolve(session);
        if (ctx.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Unauthorized");
        }
        if (!groupService.revokeShare(ctx.get(), id, email)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Group is not shared with " + email);
        }
        return ResponseEntity.noContent().build();
    }

    public record GroupRequest(String name, String description) {
    }

    public record SharedRequest(boolean shared) {
    }

    public record ShareRequest(String email) {
    }
}
