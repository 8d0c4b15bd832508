package com.wangbin.sentinel.core.history;

import com.wangbin.sentinel.core.health.HealthSummary;
import lombok.Getter;

import java.util.function.ToDoubleFunction;

/**
 * 参与趋势计算的摘要指标
 */
@Getter
public enum TrendMetric {

    PACKET_LOSS("packet_loss", HealthSummary::getPacketLoss),
    LATENCY("latency", HealthSummary::getAvgLatencyMs),
    WIFI_CLIENTS("wifi_clients", HealthSummary::getWifiClients),
    BANDWIDTH_IN("bandwidth_in", HealthSummary::getBandwidthInMbps),
    BANDWIDTH_OUT("bandwidth_out", HealthSummary::getBandwidthOutMbps);

    private final String code;
    private final ToDoubleFunction<HealthSummary> extractor;

    TrendMetric(String code, ToDoubleFunction<HealthSummary> extractor) {
        this.code = code;
        this.extractor = extractor;
    }

    public double valueOf(HealthSummary summary) {
        return extractor.applyAsDouble(summary);
    }
}
