package com.meetpoll.domain.enums;

public enum NotificationKind {
    INVITATION,
    REMINDER,
    RESPONSE_RECEIVED,
    SCHEDULE_UPDATE,
    FINALIZED
}
