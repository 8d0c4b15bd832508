package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 网络健康摘要，写入历史后不再变化。列表字段在构造时复制为只读列表。
 */
@Data
public class HealthSummary {

    private final Instant timestamp;
    private final int totalDevices;
    private final int onlineDevices;
    private final int offlineDevices;
    private final int unknownDevices;
    private final List<String> offlineList;
    private final double packetLoss;
    private final double avgLatencyMs;
    private final int wifiClients;
    private final double bandwidthInMbps;
    private final double bandwidthOutMbps;
    private final List<String> alerts;

    @Builder
    public HealthSummary(Instant timestamp,
                         int totalDevices,
                         int onlineDevices,
                         int offlineDevices,
                         int unknownDevices,
                         List<String> offlineList,
                         double packetLoss,
                         double avgLatencyMs,
                         int wifiClients,
                         double bandwidthInMbps,
                         double bandwidthOutMbps,
                         List<String> alerts) {
        this.timestamp = timestamp;
        this.totalDevices = totalDevices;
        this.onlineDevices = onlineDevices;
        this.offlineDevices = offlineDevices;
        this.unknownDevices = unknownDevices;
        this.offlineList = readOnlyCopy(offlineList);
        this.packetLoss = packetLoss;
        this.avgLatencyMs = avgLatencyMs;
        this.wifiClients = wifiClients;
        this.bandwidthInMbps = bandwidthInMbps;
        this.bandwidthOutMbps = bandwidthOutMbps;
        this.alerts = readOnlyCopy(alerts);
    }

    private static List<String> readOnlyCopy(List<String> values) {
        return values == null ? Collections.emptyList() : List.copyOf(values);
    }
}
