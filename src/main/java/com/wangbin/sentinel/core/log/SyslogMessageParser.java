package com.wangbin.sentinel.core.log;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BSD syslog（RFC 3164）报文的简化解析：PRI、主机、TAG 和正文。
 * 不符合格式的报文整体作为正文，级别记为 info。
 */
public class SyslogMessageParser {

    private static final Pattern PRI = Pattern.compile("^<(\\d{1,3})>(.*)$", Pattern.DOTALL);
    private static final Pattern HEADER = Pattern.compile(
            "^[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}\\s+(\\S+)\\s+([^:\\[\\s]+)(?:\\[\\d+])?:\\s?(.*)$",
            Pattern.DOTALL);

    public LogEntry parse(String raw, String sourceIp, Instant receivedAt) {
        String body = raw == null ? "" : raw.trim();
        String level = "info";

        Matcher pri = PRI.matcher(body);
        if (pri.matches()) {
            level = levelOf(Integer.parseInt(pri.group(1)) & 0x07);
            body = pri.group(2).trim();
        }

        String host = null;
        String tag = null;
        Matcher header = HEADER.matcher(body);
        if (header.matches()) {
            host = header.group(1);
            tag = header.group(2);
            body = header.group(3).trim();
        }

        return LogEntry.builder()
                .timestamp(receivedAt)
                .level(level)
                .host(host)
                .tag(tag)
                .message(body)
                .sourceIp(sourceIp)
                .build();
    }

    static String levelOf(int severity) {
        if (severity <= 3) {
            return "error";
        }
        if (severity == 4) {
            return "warning";
        }
        if (severity == 7) {
            return "debug";
        }
        return "info";
    }
}
