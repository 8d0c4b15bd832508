package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.health.NetworkMetricsSample;

/**
 * 丢包/延迟等网络质量数据源。
 */
@FunctionalInterface
public interface NetworkMetricsSource {

    NetworkMetricsSample sample();
}
