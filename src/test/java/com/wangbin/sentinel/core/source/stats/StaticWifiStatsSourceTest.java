package com.wangbin.sentinel.core.source.stats;

import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.health.WifiStats;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaticWifiStatsSourceTest {

    @Test
    void sumsClientsPerBand() {
        SentinelProperties.WifiConfig config = new SentinelProperties.WifiConfig();
        config.setAccessPoints(List.of(
                accessPoint("living-room", "2.4G", 12, 6),
                accessPoint("living-room-5g", "5G", 20, 36),
                accessPoint("garage", null, 3, 11)));

        WifiStats stats = new StaticWifiStatsSource(config).stats();

        assertEquals(15, stats.getBand2gClients());
        assertEquals(20, stats.getBand5gClients());
        assertEquals(35, stats.getTotalClients());
        assertEquals("2.4G", stats.getAccessPoints().get(2).getBand());
    }

    @Test
    void baselineMetricsComeFromConfig() {
        SentinelProperties.MetricsConfig config = new SentinelProperties.MetricsConfig();
        config.setPacketLossPercent(0.4);
        config.setAvgLatencyMs(12);

        assertEquals(0.4, new DefaultNetworkMetricsSource(config).sample().getPacketLossPercent());
        assertEquals(12, new DefaultNetworkMetricsSource(config).sample().getAvgLatencyMs());
    }

    private static SentinelProperties.AccessPoint accessPoint(String name, String band, int clients, int channel) {
        SentinelProperties.AccessPoint ap = new SentinelProperties.AccessPoint();
        ap.setName(name);
        ap.setBand(band);
        ap.setClients(clients);
        ap.setChannel(channel);
        return ap;
    }
}
