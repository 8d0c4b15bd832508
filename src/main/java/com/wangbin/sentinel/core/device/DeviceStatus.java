package com.wangbin.sentinel.core.device;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 设备在线状态
 */
@Getter
public enum DeviceStatus {

    ONLINE("online", "在线"),
    OFFLINE("offline", "离线"),
    UNKNOWN("unknown", "未知");

    private final String code;
    private final String description;

    DeviceStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    // 根据code获取枚举，大小写不敏感
    public static DeviceStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DeviceStatus status : values()) {
            if (status.code.equalsIgnoreCase(code.trim()) || status.name().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }
}
