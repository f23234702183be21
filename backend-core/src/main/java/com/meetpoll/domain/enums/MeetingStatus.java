package com.meetpoll.domain.enums;

public enum MeetingStatus {
    DRAFT,
    SENT,
    FINALIZED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINALIZED || this == CANCELLED;
    }
}
