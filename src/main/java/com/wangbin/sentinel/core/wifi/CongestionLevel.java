package com.wangbin.sentinel.core.wifi;

import com.wangbin.sentinel.core.health.IssueSeverity;
import lombok.Getter;

/**
 * 频段拥堵等级，由最佳信道的拥堵度决定
 */
@Getter
public enum CongestionLevel {

    HEALTHY(IssueSeverity.INFO),
    BUSY(IssueSeverity.INFO),
    CONGESTED(IssueSeverity.WARNING);

    static final int CONGESTED_ABOVE = 70;
    static final int BUSY_ABOVE = 40;

    private final IssueSeverity severity;

    CongestionLevel(IssueSeverity severity) {
        this.severity = severity;
    }

    public static CongestionLevel of(int bestUtilization) {
        if (bestUtilization > CONGESTED_ABOVE) {
            return CONGESTED;
        }
        if (bestUtilization > BUSY_ABOVE) {
            return BUSY;
        }
        return HEALTHY;
    }
}
