package com.wangbin.sentinel.core.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wangbin.sentinel.core.device.DeviceRoster;
import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.health.HealthSummary;
import com.wangbin.sentinel.core.health.Issue;
import com.wangbin.sentinel.core.health.NetworkMetricsSample;
import com.wangbin.sentinel.core.health.WifiStats;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 一次分析周期的完整输出。
 */
@Data
@Builder
public class AnalysisResult {

    private final Instant timestamp;
    private final HealthSummary summary;
    private final List<Issue> issues;
    @JsonIgnore
    private final DeviceRoster roster;
    private final BandwidthSample bandwidth;
    private final WifiStats wifiStats;
    private final NetworkMetricsSample metrics;

    /**
     * 本周期降级为空数据的数据源名称
     */
    private final List<String> degradedSources;
    private final long durationMs;
}
