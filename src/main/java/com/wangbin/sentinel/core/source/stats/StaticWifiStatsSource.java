package com.wangbin.sentinel.core.source.stats;

import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.health.AccessPointStats;
import com.wangbin.sentinel.core.health.WifiStats;
import com.wangbin.sentinel.core.source.WifiStatsSource;
import com.wangbin.sentinel.core.wifi.WifiBand;

import java.util.ArrayList;
import java.util.List;

/**
 * 按配置的 AP 列表汇总无线客户端数，路由器未提供无线 MIB 时使用。
 */
public class StaticWifiStatsSource implements WifiStatsSource {

    private final SentinelProperties.WifiConfig config;

    public StaticWifiStatsSource(SentinelProperties.WifiConfig config) {
        this.config = config;
    }

    @Override
    public WifiStats stats() {
        int band2g = 0;
        int band5g = 0;
        List<AccessPointStats> accessPoints = new ArrayList<>();
        for (SentinelProperties.AccessPoint ap : config.getAccessPoints()) {
            int clients = Math.max(0, ap.getClients());
            WifiBand band = resolveBand(ap);
            if (band == WifiBand.BAND_2G) {
                band2g += clients;
            } else {
                band5g += clients;
            }
            accessPoints.add(AccessPointStats.builder()
                    .name(ap.getName())
                    .band(band.getCode())
                    .clients(clients)
                    .channel(ap.getChannel())
                    .build());
        }
        return WifiStats.builder()
                .band2gClients(band2g)
                .band5gClients(band5g)
                .totalClients(band2g + band5g)
                .accessPoints(accessPoints)
                .build();
    }

    // 未配置频段时按信道号推断
    private static WifiBand resolveBand(SentinelProperties.AccessPoint ap) {
        WifiBand band = WifiBand.fromCode(ap.getBand());
        if (band != null) {
            return band;
        }
        return ap.getChannel() > 0 && ap.getChannel() <= 14 ? WifiBand.BAND_2G : WifiBand.BAND_5G;
    }
}
