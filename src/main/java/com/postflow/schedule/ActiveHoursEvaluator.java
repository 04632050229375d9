package com.postflow.schedule;

import com.postflow.rule.ActiveHours;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Decides whether a timestamp falls inside a rule's active-hours window.
 * <p>
 * A window whose end is before its start crosses midnight. Its early-morning part
 * belongs to the day the window started on, so 05:30 on Saturday matches a
 * Friday 22:00-06:00 window.
 */
public final class ActiveHoursEvaluator {

    private ActiveHoursEvaluator() {
    }

    /**
     * @param activeHours Window configuration, null or disabled always matches
     * @param at          Timestamp carrying the zone the window is expressed in
     * @return true if the rule may fire at {@code at}
     */
    public static boolean matches(ActiveHours activeHours, ZonedDateTime at) {
        if (activeHours == null || !activeHours.enabled()) {
            return true;
        }

        LocalTime time = at.toLocalTime();
        DayOfWeek today = at.getDayOfWeek();
        LocalTime start = activeHours.start();
        LocalTime end = activeHours.end();

        if (activeHours.crossesMidnight()) {
            if (!time.isBefore(start)) {
                return activeHours.days().contains(today);
            }
            if (time.isBefore(end)) {
                return activeHours.days().contains(today.minus(1));
            }
            return false;
        }
        return !time.isBefore(start) && time.isBefore(end) && activeHours.days().contains(today);
    }
}
