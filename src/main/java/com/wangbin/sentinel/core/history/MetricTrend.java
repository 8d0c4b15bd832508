package com.wangbin.sentinel.core.history;

import lombok.Builder;
import lombok.Data;

/**
 * 单个指标在时间窗口内的统计与趋势。
 */
@Data
@Builder
public class MetricTrend {

    private final double avg;
    private final double max;
    private final double min;
    private final TrendDirection trend;
}
