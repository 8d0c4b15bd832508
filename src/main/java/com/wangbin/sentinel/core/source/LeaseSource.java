package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.device.LeaseRecord;

import java.util.List;

/**
 * DHCP 租约数据源。
 */
@FunctionalInterface
public interface LeaseSource {

    List<LeaseRecord> leases();
}
