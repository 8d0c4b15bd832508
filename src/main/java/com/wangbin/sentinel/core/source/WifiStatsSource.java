package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.health.WifiStats;

/**
 * 无线客户端统计数据源。
 */
@FunctionalInterface
public interface WifiStatsSource {

    WifiStats stats();
}
