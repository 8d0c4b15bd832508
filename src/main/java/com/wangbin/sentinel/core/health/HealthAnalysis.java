package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 聚合器输出：摘要 + 问题列表（非空）。
 */
@Data
@Builder
public class HealthAnalysis {

    private final HealthSummary summary;
    private final List<Issue> issues;
}
