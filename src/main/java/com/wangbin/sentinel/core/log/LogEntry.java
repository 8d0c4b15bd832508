package com.wangbin.sentinel.core.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 一条路由器日志。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogEntry {

    private final Instant timestamp;

    /**
     * error / warning / info / debug
     */
    private final String level;
    private final String host;
    private final String tag;
    private final String message;
    private final String sourceIp;
}
