package com.wangbin.sentinel.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),
    DATA_INVALID(1003, "数据无效"),

    // 数据源相关错误
    SOURCE_ERROR(2000, "数据源错误"),
    SNMP_ERROR(2001, "SNMP 采集错误"),
    LEASE_ERROR(2002, "DHCP 租约读取错误"),
    SCAN_ERROR(2003, "无线扫描错误"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用"),
    TIMEOUT_ERROR(5005, "超时错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
