package com.wangbin.sentinel.core.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.Map;

/**
 * 指定小时窗口的趋势报告。窗口内没有数据时 trend 为 no_data。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendReport {

    public static final String NO_DATA = "no_data";

    private final int periodHours;
    private final int dataPoints;

    /**
     * 仅在无数据时为 {@value #NO_DATA}
     */
    private final String trend;
    private final String message;

    @Builder.Default
    private final Map<String, MetricTrend> metrics = Collections.emptyMap();

    public static TrendReport noData(int periodHours) {
        return TrendReport.builder()
                .periodHours(periodHours)
                .dataPoints(0)
                .trend(NO_DATA)
                .message("暂无历史数据")
                .build();
    }

    public boolean isNoData() {
        return NO_DATA.equals(trend);
    }

    public MetricTrend metric(TrendMetric metric) {
        return metrics.get(metric.getCode());
    }
}
