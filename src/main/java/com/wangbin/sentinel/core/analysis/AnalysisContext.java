package com.wangbin.sentinel.core.analysis;

import com.wangbin.sentinel.core.health.AnalysisThresholds;
import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.health.IssueRepeatPolicy;
import com.wangbin.sentinel.core.health.NetworkMetricsSample;
import com.wangbin.sentinel.core.health.WifiStats;
import com.wangbin.sentinel.core.history.HistoryTracker;
import com.wangbin.sentinel.core.source.BandwidthSource;
import com.wangbin.sentinel.core.source.DiscoverySource;
import com.wangbin.sentinel.core.source.LeaseSource;
import com.wangbin.sentinel.core.source.NetworkMetricsSource;
import com.wangbin.sentinel.core.source.WifiObservationSource;
import com.wangbin.sentinel.core.source.WifiStatsSource;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.util.Collections;

/**
 * 分析编排所需的全部协作者与参数，未提供的数据源以空数据代替。
 */
@Getter
@Builder
public class AnalysisContext {

    @Builder.Default
    private final DiscoverySource discoverySource = Collections::emptyList;
    @Builder.Default
    private final LeaseSource leaseSource = Collections::emptyList;
    @Builder.Default
    private final BandwidthSource bandwidthSource = () -> BandwidthSample.empty(null);
    @Builder.Default
    private final WifiStatsSource wifiStatsSource = WifiStats::empty;
    @Builder.Default
    private final NetworkMetricsSource metricsSource = NetworkMetricsSample::empty;
    @Builder.Default
    private final WifiObservationSource wifiObservationSource = Collections::emptyList;

    @Builder.Default
    private final AnalysisThresholds thresholds = AnalysisThresholds.defaults();
    @Builder.Default
    private final Clock clock = Clock.systemUTC();
    @Builder.Default
    private final IssueRepeatPolicy repeatPolicy = IssueRepeatPolicy.REPEAT;
    @Builder.Default
    private final int historyCapacity = HistoryTracker.DEFAULT_CAPACITY;
}
