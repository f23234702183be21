package com.meetpoll.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Input for creating a meeting. Participants come from {@code contactIds}, from the members of
 * {@code groupId}, or both; {@code groupMemberIds} narrows the group to a subset of its members.
 */
public record MeetingDraft(
        String title,
        String description,
        List<SlotProposal> slots,
        List<UUID> contactIds,
        UUID groupId,
        List<UUID> groupMemberIds
) {
    public MeetingDraft {
        slots = copy(slots);
        contactIds = copy(contactIds);
        groupMemberIds = copy(groupMemberIds);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
