package com.wangbin.sentinel.core.health;

import com.wangbin.sentinel.core.config.SentinelProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 分析阈值。非法取值（负数、NaN、告警值高于严重值）回退到默认值。
 */
@Slf4j
@Data
@Builder(toBuilder = true)
public class AnalysisThresholds {

    public static final Duration DEFAULT_OFFLINE_THRESHOLD = Duration.ofMinutes(30);
    public static final double DEFAULT_PACKET_LOSS_WARNING = 1.0;
    public static final double DEFAULT_PACKET_LOSS_CRITICAL = 5.0;
    public static final double DEFAULT_LATENCY_WARNING_MS = 100;
    public static final double DEFAULT_LATENCY_CRITICAL_MS = 500;
    public static final int DEFAULT_WIFI_CLIENT_LIMIT = 100;

    @Builder.Default
    private final Duration offlineThreshold = DEFAULT_OFFLINE_THRESHOLD;
    @Builder.Default
    private final double packetLossWarning = DEFAULT_PACKET_LOSS_WARNING;
    @Builder.Default
    private final double packetLossCritical = DEFAULT_PACKET_LOSS_CRITICAL;
    @Builder.Default
    private final double latencyWarningMs = DEFAULT_LATENCY_WARNING_MS;
    @Builder.Default
    private final double latencyCriticalMs = DEFAULT_LATENCY_CRITICAL_MS;
    @Builder.Default
    private final int wifiClientLimit = DEFAULT_WIFI_CLIENT_LIMIT;

    public static AnalysisThresholds defaults() {
        return AnalysisThresholds.builder().build();
    }

    public static AnalysisThresholds from(SentinelProperties.AnalysisConfig config) {
        if (config == null) {
            return defaults();
        }
        return AnalysisThresholds.builder()
                .offlineThreshold(config.getOfflineThreshold())
                .packetLossWarning(config.getPacketLossWarning())
                .packetLossCritical(config.getPacketLossCritical())
                .latencyWarningMs(config.getLatencyWarningMs())
                .latencyCriticalMs(config.getLatencyCriticalMs())
                .wifiClientLimit(config.getWifiClientLimit())
                .build()
                .sanitize();
    }

    /**
     * 校验并修正阈值，返回可直接使用的副本
     */
    public AnalysisThresholds sanitize() {
        Duration offline = offlineThreshold;
        if (offline == null || offline.isNegative() || offline.isZero()) {
            log.warn("离线阈值无效: {}，使用默认值 {}", offline, DEFAULT_OFFLINE_THRESHOLD);
            offline = DEFAULT_OFFLINE_THRESHOLD;
        }

        double lossWarning = packetLossWarning;
        double lossCritical = packetLossCritical;
        if (!validPair(lossWarning, lossCritical)) {
            log.warn("丢包阈值无效: warning={}, critical={}，使用默认值 {}/{}",
                    lossWarning, lossCritical, DEFAULT_PACKET_LOSS_WARNING, DEFAULT_PACKET_LOSS_CRITICAL);
            lossWarning = DEFAULT_PACKET_LOSS_WARNING;
            lossCritical = DEFAULT_PACKET_LOSS_CRITICAL;
        }

        double latencyWarning = latencyWarningMs;
        double latencyCritical = latencyCriticalMs;
        if (!validPair(latencyWarning, latencyCritical)) {
            log.warn("延迟阈值无效: warning={}, critical={}，使用默认值 {}/{}",
                    latencyWarning, latencyCritical, DEFAULT_LATENCY_WARNING_MS, DEFAULT_LATENCY_CRITICAL_MS);
            latencyWarning = DEFAULT_LATENCY_WARNING_MS;
            latencyCritical = DEFAULT_LATENCY_CRITICAL_MS;
        }

        int clientLimit = wifiClientLimit;
        if (clientLimit <= 0) {
            log.warn("WiFi 客户端上限无效: {}，使用默认值 {}", clientLimit, DEFAULT_WIFI_CLIENT_LIMIT);
            clientLimit = DEFAULT_WIFI_CLIENT_LIMIT;
        }

        return toBuilder()
                .offlineThreshold(offline)
                .packetLossWarning(lossWarning)
                .packetLossCritical(lossCritical)
                .latencyWarningMs(latencyWarning)
                .latencyCriticalMs(latencyCritical)
                .wifiClientLimit(clientLimit)
                .build();
    }

    private static boolean validPair(double warning, double critical) {
        return Double.isFinite(warning) && Double.isFinite(critical)
                && warning > 0 && critical > 0 && warning <= critical;
    }
}
