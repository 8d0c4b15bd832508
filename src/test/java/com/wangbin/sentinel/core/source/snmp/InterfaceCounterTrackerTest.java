package com.wangbin.sentinel.core.source.snmp;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterfaceCounterTrackerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void firstPollHasNoRate() {
        InterfaceCounterTracker tracker = new InterfaceCounterTracker();
        double[] rates = tracker.update(Map.of("eth0", new long[]{1_000, 2_000}), T0);
        assertEquals(0, rates[0]);
        assertEquals(0, rates[1]);
    }

    @Test
    void deltaIsConvertedToMbps() {
        InterfaceCounterTracker tracker = new InterfaceCounterTracker();
        tracker.update(Map.of("eth0", new long[]{0, 0}, "wlan0", new long[]{0, 0}), T0);

        // 10 秒内入方向共 12.5MB -> 10 Mbps，出方向 2.5MB -> 2 Mbps
        double[] rates = tracker.update(Map.of(
                "eth0", new long[]{10_000_000, 2_000_000},
                "wlan0", new long[]{2_500_000, 500_000}), T0.plusSeconds(10));

        assertEquals(10.0, rates[0], 1e-9);
        assertEquals(2.0, rates[1], 1e-9);
    }

    @Test
    void counter32WrapIsHandled() {
        assertEquals(16, InterfaceCounterTracker.delta(0xFFFFFFF0L, 0));
        assertEquals(0, InterfaceCounterTracker.delta(0x1_0000_0010L, 5));
        assertEquals(5, InterfaceCounterTracker.delta(10, 15));
    }

    @Test
    void newInterfaceIsIgnoredUntilItHasBaseline() {
        InterfaceCounterTracker tracker = new InterfaceCounterTracker();
        tracker.update(Map.of("eth0", new long[]{0, 0}), T0);

        double[] rates = tracker.update(Map.of(
                "eth0", new long[]{1_250_000, 0},
                "eth1", new long[]{999_999_999, 0}), T0.plusSeconds(1));

        assertEquals(10.0, rates[0], 1e-9);
    }
}
