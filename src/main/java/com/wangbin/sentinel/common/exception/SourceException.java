package com.wangbin.sentinel.common.exception;

import com.wangbin.sentinel.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 外部数据源（SNMP、租约文件、无线扫描等）读取失败。
 * 分析流程捕获后以空数据继续，不会中断一次分析周期。
 */
@Getter
public class SourceException extends BusinessException {

    private final String source;

    public SourceException(ResultCode resultCode, String source, String message) {
        super(resultCode, message, (Object) null);
        this.source = source;
    }

    public SourceException(ResultCode resultCode, String source, String message, Throwable cause) {
        super(resultCode, message, cause);
        this.source = source;
    }

    public static SourceException snmp(String source, String message, Throwable cause) {
        return new SourceException(ResultCode.SNMP_ERROR, source, message, cause);
    }

    public static SourceException lease(String message, Throwable cause) {
        return new SourceException(ResultCode.LEASE_ERROR, "dhcp-lease", message, cause);
    }

    public static SourceException scan(String message) {
        return new SourceException(ResultCode.SCAN_ERROR, "wifi-scan", message);
    }

    public static SourceException timeout(String source, long timeoutMillis) {
        return new SourceException(ResultCode.TIMEOUT_ERROR, source, source + " 超时(" + timeoutMillis + "ms)");
    }
}
