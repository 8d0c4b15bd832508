package com.wangbin.sentinel.core.wifi;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 单个信道的拥堵统计。
 */
@Data
@Builder
public class ChannelStat {

    private final int channel;
    private final int frequency;
    private final WifiBand band;

    /**
     * 拥堵度 0-100
     */
    private final int utilizationPercent;

    private final int networksCount;

    @Builder.Default
    private final List<WifiNetworkObservation> observations = Collections.emptyList();
}
