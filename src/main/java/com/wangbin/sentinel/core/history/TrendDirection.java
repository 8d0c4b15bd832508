package com.wangbin.sentinel.core.history;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 趋势方向：后半段均值相对前半段均值的变化
 */
@Getter
public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    static final double INCREASE_RATIO = 1.2;
    static final double DECREASE_RATIO = 0.8;

    private final String code;

    TrendDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TrendDirection compare(double firstHalfAvg, double secondHalfAvg) {
        if (secondHalfAvg > firstHalfAvg * INCREASE_RATIO) {
            return INCREASING;
        }
        if (secondHalfAvg < firstHalfAvg * DECREASE_RATIO) {
            return DECREASING;
        }
        return STABLE;
    }
}
