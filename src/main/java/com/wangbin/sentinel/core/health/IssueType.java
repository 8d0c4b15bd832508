package com.wangbin.sentinel.core.health;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 问题类型标签
 */
@Getter
public enum IssueType {

    DEVICE_OFFLINE("device_offline"),
    PACKET_LOSS("packet_loss"),
    LATENCY("latency"),
    WIFI_CONGESTION("wifi_congestion"),
    HEALTHY("healthy"),
    /**
     * 重复抑制后没有新问题
     */
    UNCHANGED("unchanged");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
