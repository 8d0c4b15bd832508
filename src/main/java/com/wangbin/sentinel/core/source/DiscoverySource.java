package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.device.DiscoveryRecord;

import java.util.List;

/**
 * 设备发现数据源（ARP/邻居表等）。
 */
@FunctionalInterface
public interface DiscoverySource {

    List<DiscoveryRecord> discover();
}
