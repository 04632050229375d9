package com.postflow.schedule;

import com.postflow.rule.ActiveHours;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ActiveHoursEvaluator.
 * 2024-05-03 is a Friday.
 */
class ActiveHoursEvaluatorTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    private static final ActiveHours WEEKEND_NIGHTS = new ActiveHours(true, LocalTime.of(22, 0),
            LocalTime.of(6, 0), EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    private static final ActiveHours OFFICE_HOURS = new ActiveHours(true, LocalTime.of(9, 0),
            LocalTime.of(17, 0), EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Window crossing midnight belongs to the day it started")
    @CsvSource({
            "2024-05-03T23:30, true",   // Friday night
            "2024-05-04T07:00, false",  // Saturday morning, after the window
            "2024-05-04T05:30, true",   // Saturday early, Friday's window
            "2024-05-03T05:30, false",  // Friday early, Thursday's window
            "2024-05-02T23:30, false",  // Thursday night
            "2024-05-06T05:30, true",   // Monday early, Sunday's window
            "2024-05-06T22:00, false",  // Monday night
            "2024-05-03T22:00, true",   // start is inclusive
            "2024-05-04T06:00, false"   // end is exclusive
    })
    void crossMidnightWindow(String localDateTime, boolean expected) {
        assertEquals(expected, ActiveHoursEvaluator.matches(WEEKEND_NIGHTS, at(localDateTime)));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Same-day window matches start inclusive, end exclusive, on listed days")
    @CsvSource({
            "2024-05-06T09:00, true",
            "2024-05-06T16:59, true",
            "2024-05-06T17:00, false",
            "2024-05-06T08:59, false",
            "2024-05-04T10:00, false"
    })
    void sameDayWindow(String localDateTime, boolean expected) {
        assertEquals(expected, ActiveHoursEvaluator.matches(OFFICE_HOURS, at(localDateTime)));
    }

    @Test
    @DisplayName("Absent or disabled windows always match")
    void absentOrDisabledAlwaysMatch() {
        ZonedDateTime anyTime = at("2024-05-04T03:00");

        assertTrue(ActiveHoursEvaluator.matches(null, anyTime));
        assertTrue(ActiveHoursEvaluator.matches(ActiveHours.disabled(), anyTime));
    }

    @Test
    @DisplayName("Evaluation uses the local time of the given zone")
    void usesLocalTime() {
        // 21:30 UTC is 23:30 in Berlin during summer time
        ZonedDateTime utc = ZonedDateTime.of(LocalDateTime.parse("2024-05-03T21:30"), ZoneId.of("UTC"));

        assertFalse(ActiveHoursEvaluator.matches(WEEKEND_NIGHTS, utc));
        assertTrue(ActiveHoursEvaluator.matches(WEEKEND_NIGHTS, utc.withZoneSameInstant(ZONE)));
    }

    private static ZonedDateTime at(String localDateTime) {
        return ZonedDateTime.of(LocalDateTime.parse(localDateTime), ZONE);
    }
}
