package com.wangbin.sentinel.core.device;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * DHCP 租约记录。
 */
@Data
@Builder
public class LeaseRecord {

    private final String ip;
    private final String mac;
    private final String hostname;

    /**
     * 租约到期时间，null 表示未知（视为有效）
     */
    private final Instant expiresAt;

    public boolean isActive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
