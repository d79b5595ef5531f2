package com.cycleindicators.engine.indicator;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Time-of-day factor for the timed score indicators. Distance is measured in minutes to the
 * nearest of the 08:00 and 20:00 UTC calculation slots, wrapping around midnight; the factor
 * is 1 on a slot and falls linearly by {@code drop} over six hours, never below {@code floor}.
 */
public final class ScheduleProximity {

    public static final List<LocalTime> SLOTS = List.of(LocalTime.of(8, 0), LocalTime.of(20, 0));

    private static final int MINUTES_PER_DAY = 24 * 60;
    private static final double MAX_DISTANCE = 6 * 60;

    private ScheduleProximity() {}

    public static int minutesToNearestSlot(Instant now) {
        LocalTime time = LocalTime.ofInstant(now, ZoneOffset.UTC);
        int current = time.getHour() * 60 + time.getMinute();
        int nearest = Integer.MAX_VALUE;
        for (LocalTime slot : SLOTS) {
            int diff = Math.abs(current - (slot.getHour() * 60 + slot.getMinute()));
            nearest = Math.min(nearest, Math.min(diff, MINUTES_PER_DAY - diff));
        }
        return nearest;
    }

    public static double weight(Instant now, double drop, double floor) {
        return Math.max(floor, 1.0 - minutesToNearestSlot(now) / MAX_DISTANCE * drop);
    }
}
