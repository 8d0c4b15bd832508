package com.wangbin.sentinel.core.wifi;

import com.wangbin.sentinel.core.health.IssueSeverity;
import lombok.Builder;
import lombok.Data;

/**
 * 单频段的信道建议。
 */
@Data
@Builder
public class ChannelRecommendation {

    private final WifiBand band;
    private final CongestionLevel level;
    private final int bestChannel;
    private final int utilizationPercent;
    private final String message;

    public IssueSeverity getSeverity() {
        return level.getSeverity();
    }
}
