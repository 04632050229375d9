package com.postflow.rule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Recurring weekly window restricting when a rule may fire.
 *
 * @param enabled Whether the window applies; a disabled window always matches
 * @param start   Window start (inclusive)
 * @param end     Window end (exclusive); earlier than start means the window crosses midnight
 * @param days    Days on which the window starts
 */
public record ActiveHours(boolean enabled, LocalTime start, LocalTime end, Set<DayOfWeek> days) {

    public ActiveHours {
        days = days.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(days));
    }

    public static ActiveHours disabled() {
        return new ActiveHours(false, LocalTime.MIDNIGHT, LocalTime.MIDNIGHT, Set.of());
    }

    public boolean crossesMidnight() {
        return end.isBefore(start);
    }
}
