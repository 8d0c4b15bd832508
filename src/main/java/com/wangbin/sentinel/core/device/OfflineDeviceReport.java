package com.wangbin.sentinel.core.device;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 离线设备报告。
 */
@Data
@Builder
public class OfflineDeviceReport {

    private final int count;

    @Builder.Default
    private final List<Device> devices = Collections.emptyList();

    private final String recommendation;

    public static OfflineDeviceReport from(DeviceRoster roster) {
        List<Device> offline = roster.byStatus(DeviceStatus.OFFLINE);
        return OfflineDeviceReport.builder()
                .count(offline.size())
                .devices(offline)
                .recommendation(offline.isEmpty() ? "当前无离线设备" : "检查这些设备的电源和网络连接")
                .build();
    }
}
