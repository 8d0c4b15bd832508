package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.health.BandwidthSample;

/**
 * 带宽数据源。
 */
@FunctionalInterface
public interface BandwidthSource {

    BandwidthSample sample();
}
