package com.wangbin.sentinel.core.device;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 名册中的设备快照，每次刷新整体重建。
 */
@Data
@Builder(toBuilder = true)
public class Device {

    private final String ip;
    private final String mac;
    private final String hostname;
    private final DeviceSource source;
    private final DeviceStatus status;
    private final Instant lastSeen;
    private final Instant firstSeen;
}
