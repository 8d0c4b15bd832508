package com.wangbin.sentinel.core.device;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 发现源给出的一条设备记录。
 */
@Data
@Builder
public class DiscoveryRecord {

    private final String ip;
    private final String mac;

    /**
     * 最近一次出现时间，未知时为 null（不参与离线判定）
     */
    private final Instant lastSeen;

    /**
     * 首次出现时间，由发现源跨周期维护，可为 null
     */
    private final Instant firstSeen;
}
