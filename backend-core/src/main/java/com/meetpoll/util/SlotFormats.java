package com.meetpoll.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class SlotFormats {

    private static final DateTimeFormatter LONG_FMT =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    private SlotFormats() {
    }

    /**
     * "Tuesday, March 05, 2024 at 10:00 AM". Used for invitations and as the stored finalized slot.
     */
    public static String longForm(Instant startsAt, ZoneId zone) {
        return startsAt.atZone(zone).format(LONG_FMT);
    }

    public static String withDuration(Instant startsAt, int durationMinutes, ZoneId zone) {
        return longForm(startsAt, zone) + " (" + durationMinutes + " min)";
    }
}
