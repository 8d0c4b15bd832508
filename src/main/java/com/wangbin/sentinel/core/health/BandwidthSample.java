package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 出入方向带宽（Mbps）。
 */
@Data
@Builder
public class BandwidthSample {

    private final double inMbps;
    private final double outMbps;
    private final Instant timestamp;

    public static BandwidthSample empty(Instant timestamp) {
        return BandwidthSample.builder().timestamp(timestamp).build();
    }
}
