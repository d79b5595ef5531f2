package com.cycleindicators.engine.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScheduleProximityTest {

    @Test
    @DisplayName("an hour after the morning slot")
    void afterMorningSlot() {
        assertEquals(60, ScheduleProximity.minutesToNearestSlot(Instant.parse("2024-03-01T09:00:00Z")));
    }

    @Test
    @DisplayName("01:00 is closer to the previous evening slot than to 08:00")
    void wrapsAroundMidnight() {
        assertEquals(300, ScheduleProximity.minutesToNearestSlot(Instant.parse("2024-03-01T01:00:00Z")));
    }

    @Test
    void onSlot() {
        Instant evening = Instant.parse("2024-03-01T20:00:00Z");

        assertEquals(0, ScheduleProximity.minutesToNearestSlot(evening));
        assertEquals(1.0, ScheduleProximity.weight(evening, 0.3, 0.7), 1e-12);
    }

    @Test
    @DisplayName("14:00 is six hours from both slots: the factor bottoms out")
    void furthestPoint() {
        Instant afternoon = Instant.parse("2024-03-01T14:00:00Z");

        assertEquals(360, ScheduleProximity.minutesToNearestSlot(afternoon));
        assertEquals(0.5, ScheduleProximity.weight(afternoon, 0.5, 0.5), 1e-12);
        assertEquals(0.7, ScheduleProximity.weight(afternoon, 0.3, 0.7), 1e-12);
    }
}
