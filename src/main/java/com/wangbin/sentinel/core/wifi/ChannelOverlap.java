package com.wangbin.sentinel.core.wifi;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 2.4G 重叠信道组：高拥堵信道及其同样拥堵的相邻信道。
 */
@Data
@Builder
public class ChannelOverlap {

    private final int channel;
    private final int utilizationPercent;
    private final List<Integer> neighbours;

    public String describe() {
        return channel + " 信道与 " + neighbours + " 重叠";
    }
}
