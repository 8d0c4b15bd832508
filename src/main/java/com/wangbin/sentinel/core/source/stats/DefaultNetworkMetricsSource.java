package com.wangbin.sentinel.core.source.stats;

import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.health.NetworkMetricsSample;
import com.wangbin.sentinel.core.source.NetworkMetricsSource;

/**
 * 配置中的网络质量基线，不做主动探测。
 */
public class DefaultNetworkMetricsSource implements NetworkMetricsSource {

    private final SentinelProperties.MetricsConfig config;

    public DefaultNetworkMetricsSource(SentinelProperties.MetricsConfig config) {
        this.config = config;
    }

    @Override
    public NetworkMetricsSample sample() {
        return NetworkMetricsSample.builder()
                .packetLossPercent(config.getPacketLossPercent())
                .avgLatencyMs(config.getAvgLatencyMs())
                .maxLatencyMs(config.getMaxLatencyMs())
                .jitterMs(config.getJitterMs())
                .tcpRetries(config.getTcpRetries())
                .udpErrors(config.getUdpErrors())
                .build();
    }
}
