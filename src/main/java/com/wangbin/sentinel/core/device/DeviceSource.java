package com.wangbin.sentinel.core.device;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 设备记录来源
 */
@Getter
public enum DeviceSource {

    DISCOVERY("discovery", "ARP/邻居表发现");

    private final String code;
    private final String description;

    DeviceSource(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
