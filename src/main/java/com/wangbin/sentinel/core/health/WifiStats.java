package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 无线客户端统计。
 */
@Data
@Builder
public class WifiStats {

    private static final WifiStats EMPTY = WifiStats.builder().build();

    private final int band2gClients;
    private final int band5gClients;
    private final int totalClients;

    @Builder.Default
    private final List<AccessPointStats> accessPoints = Collections.emptyList();

    public static WifiStats empty() {
        return EMPTY;
    }
}
