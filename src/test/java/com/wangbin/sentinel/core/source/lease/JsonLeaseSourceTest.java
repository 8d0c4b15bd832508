package com.wangbin.sentinel.core.source.lease;

import com.wangbin.sentinel.core.device.LeaseRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLeaseSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesNoLeases() {
        assertTrue(new JsonLeaseSource(tempDir.resolve("absent.json")).leases().isEmpty());
    }

    @Test
    void parsesEpochAndIsoExpiry() throws IOException {
        Path file = tempDir.resolve("dhcp_leases.json");
        Files.writeString(file, "["
                + "{\"ip\":\"10.0.0.5\",\"mac\":\"AA:BB:CC:DD:EE:FF\",\"hostname\":\"laptop\",\"expires\":1772366400},"
                + "{\"ip\":\"10.0.0.6\",\"hostname\":\"tv\",\"expires\":\"2026-03-01T13:00:00Z\"},"
                + "{\"ip\":\"10.0.0.7\"},"
                + "{\"hostname\":\"no-ip\"},"
                + "\"garbage\""
                + "]", StandardCharsets.UTF_8);

        List<LeaseRecord> leases = new JsonLeaseSource(file).leases();

        assertEquals(3, leases.size());
        assertEquals("laptop", leases.get(0).getHostname());
        assertEquals(Instant.ofEpochSecond(1772366400L), leases.get(0).getExpiresAt());
        assertEquals(Instant.parse("2026-03-01T13:00:00Z"), leases.get(1).getExpiresAt());
        assertNull(leases.get(2).getExpiresAt());
        assertTrue(leases.get(2).isActive(Instant.parse("2030-01-01T00:00:00Z")));
    }

    @Test
    void malformedFileGivesNoLeases() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertTrue(new JsonLeaseSource(file).leases().isEmpty());
    }

    @Test
    void savedLeasesCanBeReadBack() {
        Path file = tempDir.resolve("nested/dhcp_leases.json");
        JsonLeaseSource source = new JsonLeaseSource(file);
        Instant expires = Instant.parse("2026-03-02T00:00:00Z");

        source.save(List.of(LeaseRecord.builder().ip("10.0.0.9").mac("11:22:33:44:55:66").hostname("printer")
                .expiresAt(expires).build()));

        List<LeaseRecord> leases = source.leases();
        assertEquals(1, leases.size());
        assertEquals("printer", leases.get(0).getHostname());
        assertEquals(expires, leases.get(0).getExpiresAt());
    }

    @Test
    void expiryParsingTolerance() {
        assertNull(JsonLeaseSource.parseExpiry(null));
        assertNull(JsonLeaseSource.parseExpiry(" "));
        assertNull(JsonLeaseSource.parseExpiry("tomorrow"));
        assertEquals(Instant.ofEpochSecond(100), JsonLeaseSource.parseExpiry("100"));
        assertEquals(Instant.parse("2026-03-01T13:00:00Z"), JsonLeaseSource.parseExpiry("2026-03-01T21:00:00+08:00"));
    }
}
