package com.wangbin.sentinel.core.source.lease;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.sentinel.common.exception.SourceException;
import com.wangbin.sentinel.common.utils.JsonUtil;
import com.wangbin.sentinel.core.device.LeaseRecord;
import com.wangbin.sentinel.core.source.LeaseSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DHCP 租约缓存文件（JSON 数组）。
 * <p>
 * 每个元素包含 ip、mac、hostname 和可选的 expires（epoch 秒或 ISO-8601）。
 * 文件不存在时返回空列表；文件不可读时抛出 {@link SourceException}。
 */
@Slf4j
public class JsonLeaseSource implements LeaseSource {

    private final Path leaseFile;

    public JsonLeaseSource(Path leaseFile) {
        this.leaseFile = leaseFile;
    }

    @Override
    public List<LeaseRecord> leases() {
        if (leaseFile == null || !Files.exists(leaseFile)) {
            return Collections.emptyList();
        }
        String content;
        try {
            content = Files.readString(leaseFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw SourceException.lease("读取租约文件失败: " + leaseFile, e);
        }

        List<LeaseRecord> leases = new ArrayList<>();
        for (JSONObject item : JsonUtil.parseObjectArray(content)) {
            String ip = item.getString("ip");
            if (ip == null || ip.isBlank()) {
                continue;
            }
            leases.add(LeaseRecord.builder()
                    .ip(ip.trim())
                    .mac(item.getString("mac"))
                    .hostname(item.getString("hostname"))
                    .expiresAt(parseExpiry(item.get("expires")))
                    .build());
        }
        log.debug("加载租约 {} 条: {}", leases.size(), leaseFile);
        return leases;
    }

    /**
     * 覆盖写入租约缓存文件
     */
    public void save(List<LeaseRecord> leases) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (LeaseRecord lease : leases) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("ip", lease.getIp());
            item.put("mac", lease.getMac());
            item.put("hostname", lease.getHostname());
            if (lease.getExpiresAt() != null) {
                item.put("expires", lease.getExpiresAt().toString());
            }
            items.add(item);
        }
        try {
            Path parent = leaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = JsonUtil.toJsonStringPretty(items);
            Files.writeString(leaseFile, json != null ? json : "[]", StandardCharsets.UTF_8);
            log.info("租约缓存已保存 {} 条: {}", leases.size(), leaseFile);
        } catch (IOException e) {
            throw SourceException.lease("写入租约文件失败: " + leaseFile, e);
        }
    }

    static Instant parseExpiry(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(text));
        } catch (NumberFormatException ignored) {
            // 非数字时按 ISO-8601 解析
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e2) {
                log.debug("无法解析租约到期时间: {}", text);
                return null;
            }
        }
    }
}
