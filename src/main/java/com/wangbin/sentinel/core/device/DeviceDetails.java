package com.wangbin.sentinel.core.device;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * 单设备详情。
 */
@Data
@Builder
public class DeviceDetails {

    private final Device device;
    private final Instant firstSeen;

    /**
     * 离线时长（秒），仅离线设备有值
     */
    private final Long offlineDurationSeconds;

    public static DeviceDetails of(Device device, Instant now) {
        Long offlineSeconds = null;
        if (device.getStatus() == DeviceStatus.OFFLINE && device.getLastSeen() != null) {
            offlineSeconds = Math.max(0, Duration.between(device.getLastSeen(), now).getSeconds());
        }
        return DeviceDetails.builder()
                .device(device)
                .firstSeen(device.getFirstSeen() != null ? device.getFirstSeen() : device.getLastSeen())
                .offlineDurationSeconds(offlineSeconds)
                .build();
    }
}
