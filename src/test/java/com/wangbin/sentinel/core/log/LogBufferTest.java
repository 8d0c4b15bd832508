package com.wangbin.sentinel.core.log;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LogBufferTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void trimsToRetainedSizeWhenFull() {
        LogBuffer buffer = new LogBuffer(10, 5);
        for (int i = 1; i <= 10; i++) {
            buffer.add(entry("info", "m" + i));
        }
        assertEquals(10, buffer.size());

        buffer.add(entry("info", "m11"));

        assertEquals(5, buffer.size());
        assertEquals(List.of("m7", "m8", "m9", "m10", "m11"), messages(buffer.recent(100, null)));
    }

    @Test
    void recentReturnsNewestInChronologicalOrder() {
        LogBuffer buffer = new LogBuffer(100, 50);
        buffer.add(entry("info", "a"));
        buffer.add(entry("error", "b"));
        buffer.add(entry("info", "c"));
        buffer.add(entry("ERROR", "d"));

        assertEquals(List.of("c", "d"), messages(buffer.recent(2, null)));
        assertEquals(List.of("b", "d"), messages(buffer.recent(10, "error")));
        assertTrue(buffer.recent(0, null).isEmpty());
    }

    @Test
    void syslogPriorityMapsToLevel() {
        SyslogMessageParser parser = new SyslogMessageParser();

        LogEntry entry = parser.parse("<27>Mar  1 12:00:00 openwrt dnsmasq[1234]: DHCPACK(br-lan) 10.0.0.5",
                "192.168.100.1", NOW);

        assertEquals("error", entry.getLevel());
        assertEquals("openwrt", entry.getHost());
        assertEquals("dnsmasq", entry.getTag());
        assertEquals("DHCPACK(br-lan) 10.0.0.5", entry.getMessage());
        assertEquals("192.168.100.1", entry.getSourceIp());
        assertEquals(NOW, entry.getTimestamp());
    }

    @Test
    void unstructuredSyslogKeepsWholeBody() {
        LogEntry entry = new SyslogMessageParser().parse("kernel says hi", "10.0.0.1", NOW);

        assertEquals("info", entry.getLevel());
        assertEquals("kernel says hi", entry.getMessage());
        assertNull(entry.getHost());
        assertEquals("warning", SyslogMessageParser.levelOf(4));
        assertEquals("debug", SyslogMessageParser.levelOf(7));
    }

    private static LogEntry entry(String level, String message) {
        return LogEntry.builder().timestamp(NOW).level(level).message(message).build();
    }

    private static List<String> messages(List<LogEntry> entries) {
        return entries.stream().map(LogEntry::getMessage).collect(Collectors.toList());
    }
}
