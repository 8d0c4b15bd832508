package com.wangbin.sentinel.core.health;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 问题严重级别，level 越大越严重
 */
@Getter
public enum IssueSeverity {

    INFO("info", 0),
    WARNING("warning", 1),
    CRITICAL("critical", 2);

    private final String code;
    private final int level;

    IssueSeverity(String code, int level) {
        this.code = code;
        this.level = level;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
