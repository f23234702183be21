package com.meetpoll.domain.enums;

/**
 * Attendance hint for a slot, relative to everyone invited to the meeting.
 */
public enum CoverageLevel {
    /** Every invited participant marked the slot available. */
    ALL_AVAILABLE,
    /** Every invited participant is available or maybe. */
    ALL_CAN_ATTEND,
    /** At least one participant is available. */
    PARTIAL,
    NONE;

    public static CoverageLevel of(int available, int maybe, int invited) {
        if (invited > 0 && available == invited) {
            return ALL_AVAILABLE;
        }
        if (invited > 0 && available + maybe == invited) {
            return ALL_CAN_ATTEND;
        }
        if (available > 0) {
            return PARTIAL;
        }
        return NONE;
    }
}
