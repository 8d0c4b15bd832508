package com.wangbin.sentinel.core.wifi;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 信道拥堵度评分，纯函数。
 * <p>
 * 平均信号越强说明附近干扰源越占优势，同信道网络越多争用越激烈；信号权重 0.7，数量权重 0.3。
 * <pre>
 * signalWeight = clamp((avgSignalDbm + 90) / 60, 0, 1)
 * countWeight  = clamp(count / 5, 0, 1)
 * utilization  = clamp(round(100 * (0.7 * signalWeight + 0.3 * countWeight)), 0, 100)
 * </pre>
 */
public class ChannelCongestionScorer {

    static final double SIGNAL_FLOOR_DBM = -90.0;
    static final double SIGNAL_RANGE_DB = 60.0;
    static final int SATURATION_COUNT = 5;
    static final double SIGNAL_FACTOR = 0.7;
    static final double COUNT_FACTOR = 0.3;

    public ChannelStat score(int channel, WifiBand band, Collection<WifiNetworkObservation> observations) {
        List<WifiNetworkObservation> networks = observations == null
                ? Collections.emptyList()
                : observations.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
        int frequency = band != null ? ChannelPlan.frequencyOf(band, channel) : 0;

        return ChannelStat.builder()
                .channel(channel)
                .frequency(frequency)
                .band(band)
                .utilizationPercent(utilization(networks))
                .networksCount(networks.size())
                .observations(networks)
                .build();
    }

    int utilization(List<WifiNetworkObservation> networks) {
        if (networks.isEmpty()) {
            return 0;
        }
        double avgSignal = networks.stream()
                .mapToInt(WifiNetworkObservation::getSignalDbm)
                .average()
                .orElse(SIGNAL_FLOOR_DBM);

        double signalWeight = clamp((avgSignal - SIGNAL_FLOOR_DBM) / SIGNAL_RANGE_DB, 0.0, 1.0);
        double countWeight = clamp((double) networks.size() / SATURATION_COUNT, 0.0, 1.0);

        long score = Math.round(100 * (SIGNAL_FACTOR * signalWeight + COUNT_FACTOR * countWeight));
        return (int) Math.max(0, Math.min(100, score));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
