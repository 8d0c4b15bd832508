package com.wangbin.sentinel.core.wifi;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelCongestionScorerTest {

    private final ChannelCongestionScorer scorer = new ChannelCongestionScorer();

    @Test
    void twoNetworksAtMinus50ScoreFiftyNine() {
        ChannelStat stat = scorer.score(6, WifiBand.BAND_2G, List.of(network(6, -50), network(6, -50)));

        assertEquals(59, stat.getUtilizationPercent());
        assertEquals(2, stat.getNetworksCount());
        assertEquals(2437, stat.getFrequency());
    }

    @Test
    void zeroObservationsScoreZero() {
        assertEquals(0, scorer.score(1, WifiBand.BAND_2G, Collections.emptyList()).getUtilizationPercent());
        assertEquals(0, scorer.score(1, WifiBand.BAND_2G, null).getUtilizationPercent());
    }

    @Test
    void weakSignalOnlyCountsNetworks() {
        // 信号权重截断为 0，仅剩数量权重 0.3 * 1/5
        ChannelStat stat = scorer.score(11, WifiBand.BAND_2G, List.of(network(11, -120)));
        assertEquals(6, stat.getUtilizationPercent());
    }

    @Test
    void strongCrowdedChannelIsCappedAtHundred() {
        List<WifiNetworkObservation> crowded = List.of(
                network(1, 0), network(1, 0), network(1, 0), network(1, 0), network(1, 0), network(1, 0));
        assertEquals(100, scorer.score(1, WifiBand.BAND_2G, crowded).getUtilizationPercent());
    }

    @Test
    void scoringIsIdempotent() {
        List<WifiNetworkObservation> networks = List.of(network(36, -67), network(36, -72), network(36, -40));
        int first = scorer.score(36, WifiBand.BAND_5G, networks).getUtilizationPercent();
        int second = scorer.score(36, WifiBand.BAND_5G, networks).getUtilizationPercent();
        assertEquals(first, second);
        assertTrue(first >= 0 && first <= 100);
    }

    static WifiNetworkObservation network(int channel, int signalDbm) {
        WifiBand band = channel <= 14 ? WifiBand.BAND_2G : WifiBand.BAND_5G;
        return WifiNetworkObservation.builder()
                .ssid("net-" + channel + "-" + signalDbm)
                .bssid("00:11:22:33:44:" + String.format("%02X", Math.abs(signalDbm) % 256))
                .channel(channel)
                .frequency(ChannelPlan.frequencyOf(band, channel))
                .band(band)
                .signalDbm(signalDbm)
                .build();
    }
}
