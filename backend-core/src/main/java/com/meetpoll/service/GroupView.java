package com.meetpoll.service;

import com.meetpoll.domain.enums.GroupAccess;

import java.util.UUID;

/**
 * A group as seen by one organizer: {@link GroupAccess#OWNED} for the owner,
 * {@link GroupAccess#SHARED} for a grantee of a currently shared group.
 */
public record GroupView(
        UUID id,
        String name,
        String description,
        boolean shared,
        GroupAccess access,
        String ownerEmail,
        long memberCount
) {
}
