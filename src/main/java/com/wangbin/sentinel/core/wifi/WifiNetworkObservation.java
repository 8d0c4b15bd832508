package com.wangbin.sentinel.core.wifi;

import lombok.Builder;
import lombok.Data;

/**
 * 一次扫描中观察到的无线网络（BSS）。
 */
@Data
@Builder
public class WifiNetworkObservation {

    public static final int MISSING_SIGNAL_DBM = -100;

    private final String ssid;
    private final String bssid;

    @Builder.Default
    private final int signalDbm = MISSING_SIGNAL_DBM;

    private final int channel;
    private final int frequency;
    private final WifiBand band;

    @Builder.Default
    private final String security = "Unknown";

    private final boolean hidden;

    /**
     * -100 dBm 记 0%，-30 dBm 记 100%
     */
    public int getSignalPercent() {
        int percent = (signalDbm + 100) * 100 / 70;
        return Math.max(0, Math.min(100, percent));
    }
}
