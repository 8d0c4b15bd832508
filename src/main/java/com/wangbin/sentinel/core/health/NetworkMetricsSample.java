package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

/**
 * 网络质量采样：丢包、延迟、抖动、重传。
 */
@Data
@Builder
public class NetworkMetricsSample {

    private static final NetworkMetricsSample EMPTY = NetworkMetricsSample.builder().build();

    private final double packetLossPercent;
    private final double avgLatencyMs;
    private final double maxLatencyMs;
    private final double jitterMs;
    private final long tcpRetries;
    private final long udpErrors;

    public static NetworkMetricsSample empty() {
        return EMPTY;
    }
}
