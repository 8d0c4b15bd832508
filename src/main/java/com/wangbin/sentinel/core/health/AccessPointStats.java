package com.wangbin.sentinel.core.health;

import lombok.Builder;
import lombok.Data;

/**
 * 单个 AP 的客户端统计。
 */
@Data
@Builder
public class AccessPointStats {

    private final String name;
    private final String band;
    private final int clients;
    private final int channel;
}
