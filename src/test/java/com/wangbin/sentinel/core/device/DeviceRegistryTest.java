package com.wangbin.sentinel.core.device;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final DeviceRegistry registry = new DeviceRegistry(Duration.ofMinutes(30));

    @Test
    void deviceWithoutLeaseIsUnknownThenOfflineWhenStale() {
        DiscoveryRecord record = DiscoveryRecord.builder()
                .ip("10.0.0.5")
                .mac("AA:BB:CC:DD:EE:FF")
                .lastSeen(NOW)
                .build();

        DeviceRoster fresh = registry.refresh(List.of(record), Collections.emptyList(), NOW);
        assertEquals(DeviceStatus.UNKNOWN, fresh.find("10.0.0.5").orElseThrow().getStatus());

        DeviceRoster later = registry.refresh(List.of(record), Collections.emptyList(), NOW.plus(Duration.ofMinutes(31)));
        assertEquals(DeviceStatus.OFFLINE, later.find("10.0.0.5").orElseThrow().getStatus());
        assertEquals(List.of("10.0.0.5"), later.offlineIps());
    }

    @Test
    void exactlyAtThresholdIsNotStale() {
        assertFalse(registry.isStale(NOW.minus(Duration.ofMinutes(30)), NOW));
        assertTrue(registry.isStale(NOW.minus(Duration.ofMinutes(30)).minusSeconds(1), NOW));
        assertFalse(registry.isStale(null, NOW));
    }

    @Test
    void activeLeaseMakesDeviceOnlineAndCopiesHostname() {
        DiscoveryRecord record = DiscoveryRecord.builder().ip("10.0.0.7").lastSeen(NOW).build();
        LeaseRecord lease = LeaseRecord.builder()
                .ip("10.0.0.7")
                .hostname("nas")
                .expiresAt(NOW.plus(Duration.ofHours(6)))
                .build();

        Device device = registry.refresh(List.of(record), List.of(lease), NOW).find("10.0.0.7").orElseThrow();

        assertEquals(DeviceStatus.ONLINE, device.getStatus());
        assertEquals("nas", device.getHostname());
        assertEquals(DeviceSource.DISCOVERY, device.getSource());
    }

    @Test
    void expiredLeaseIsIgnored() {
        DiscoveryRecord record = DiscoveryRecord.builder().ip("10.0.0.8").lastSeen(NOW).build();
        LeaseRecord expired = LeaseRecord.builder()
                .ip("10.0.0.8")
                .hostname("phone")
                .expiresAt(NOW.minusSeconds(1))
                .build();

        Device device = registry.refresh(List.of(record), List.of(expired), NOW).find("10.0.0.8").orElseThrow();

        assertEquals(DeviceStatus.UNKNOWN, device.getStatus());
        assertNull(device.getHostname());
    }

    @Test
    void staleOverridesActiveLease() {
        DiscoveryRecord record = DiscoveryRecord.builder().ip("10.0.0.9").lastSeen(NOW.minus(Duration.ofHours(2))).build();
        LeaseRecord lease = LeaseRecord.builder().ip("10.0.0.9").build();

        Device device = registry.refresh(List.of(record), List.of(lease), NOW).find("10.0.0.9").orElseThrow();

        assertEquals(DeviceStatus.OFFLINE, device.getStatus());
    }

    @Test
    void leaseOnlyAddressesAreNotTracked() {
        LeaseRecord lease = LeaseRecord.builder().ip("10.0.0.20").build();
        DiscoveryRecord record = DiscoveryRecord.builder().ip("10.0.0.21").lastSeen(NOW).build();

        DeviceRoster roster = registry.refresh(List.of(record), List.of(lease), NOW);

        assertEquals(1, roster.getTotal());
        assertTrue(roster.find("10.0.0.20").isEmpty());
    }

    @Test
    void emptyOrNullInputGivesEmptyRoster() {
        assertTrue(registry.refresh(null, null, NOW).isEmpty());
        assertTrue(registry.refresh(Collections.emptyList(), List.of(LeaseRecord.builder().ip("1.1.1.1").build()), NOW).isEmpty());
    }

    @Test
    void countsAlwaysAddUpToTotal() {
        List<DiscoveryRecord> records = List.of(
                DiscoveryRecord.builder().ip("10.0.0.1").lastSeen(NOW).build(),
                DiscoveryRecord.builder().ip("10.0.0.2").lastSeen(NOW.minus(Duration.ofHours(1))).build(),
                DiscoveryRecord.builder().ip("10.0.0.3").lastSeen(NOW).build(),
                DiscoveryRecord.builder().ip(" ").lastSeen(NOW).build());
        List<LeaseRecord> leases = List.of(LeaseRecord.builder().ip("10.0.0.1").build());

        DeviceRoster roster = registry.refresh(records, leases, NOW);

        assertEquals(3, roster.getTotal());
        assertEquals(1, roster.getOnline());
        assertEquals(1, roster.getOffline());
        assertEquals(1, roster.getUnknown());
        assertEquals(roster.getTotal(), roster.getOnline() + roster.getOffline() + roster.getUnknown());
    }

    @Test
    void duplicateIpLastRecordWins() {
        List<DiscoveryRecord> records = List.of(
                DiscoveryRecord.builder().ip("10.0.0.1").mac("AA").lastSeen(NOW).build(),
                DiscoveryRecord.builder().ip("10.0.0.1").mac("BB").lastSeen(NOW).build());

        DeviceRoster roster = registry.refresh(records, null, NOW);

        assertEquals(1, roster.getTotal());
        assertEquals("BB", roster.find("10.0.0.1").orElseThrow().getMac());
    }

    @Test
    void nonPositiveThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DeviceRegistry(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new DeviceRegistry(null));
    }
}
