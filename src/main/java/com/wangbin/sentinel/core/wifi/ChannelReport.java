package com.wangbin.sentinel.core.wifi;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次无线环境分析的结果。
 */
@Data
@Builder
public class ChannelReport {

    private final Instant timestamp;

    @Builder.Default
    private final List<WifiNetworkObservation> networks = Collections.emptyList();

    @Builder.Default
    private final Map<WifiBand, List<ChannelStat>> channels = Collections.emptyMap();

    @Builder.Default
    private final Map<WifiBand, ChannelRecommendation> bandRecommendations = Collections.emptyMap();

    @Builder.Default
    private final List<ChannelOverlap> overlaps = Collections.emptyList();

    private final int hiddenNetworks;

    @Builder.Default
    private final List<String> recommendations = Collections.emptyList();

    public List<ChannelStat> channelsOf(WifiBand band) {
        return channels.getOrDefault(band, Collections.emptyList());
    }
}
