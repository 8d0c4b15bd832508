package com.wangbin.sentinel.core.device;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 设备名册合并：发现记录 + DHCP 租约 -> 在线/离线/未知。
 * <p>
 * 规则按顺序执行：
 * <ol>
 *     <li>发现记录建立设备，初始状态 ONLINE；</li>
 *     <li>没有有效租约的设备降为 UNKNOWN；</li>
 *     <li>最近出现时间距今超过离线阈值的设备强制为 OFFLINE。</li>
 * </ol>
 * 只在租约中出现、未被发现的地址不进入名册。调用之间不保留状态。
 */
@Slf4j
public class DeviceRegistry {

    @Getter
    private final Duration offlineThreshold;

    public DeviceRegistry(Duration offlineThreshold) {
        if (offlineThreshold == null || offlineThreshold.isNegative() || offlineThreshold.isZero()) {
            throw new IllegalArgumentException("离线阈值必须为正数: " + offlineThreshold);
        }
        this.offlineThreshold = offlineThreshold;
    }

    public DeviceRoster refresh(Collection<DiscoveryRecord> discoveryRecords,
                                Collection<LeaseRecord> leaseRecords,
                                Instant now) {
        if (discoveryRecords == null || discoveryRecords.isEmpty()) {
            return DeviceRoster.empty();
        }

        Map<String, LeaseRecord> activeLeases = activeLeases(leaseRecords, now);
        Map<String, Device> devices = new LinkedHashMap<>();
        int skipped = 0;

        for (DiscoveryRecord record : discoveryRecords) {
            if (record == null || record.getIp() == null || record.getIp().isBlank()) {
                skipped++;
                continue;
            }
            String ip = record.getIp().trim();
            LeaseRecord lease = activeLeases.get(ip);

            DeviceStatus status = lease != null ? DeviceStatus.ONLINE : DeviceStatus.UNKNOWN;
            if (isStale(record.getLastSeen(), now)) {
                status = DeviceStatus.OFFLINE;
            }

            devices.put(ip, Device.builder()
                    .ip(ip)
                    .mac(record.getMac())
                    .hostname(lease != null ? lease.getHostname() : null)
                    .source(DeviceSource.DISCOVERY)
                    .status(status)
                    .lastSeen(record.getLastSeen())
                    .firstSeen(record.getFirstSeen())
                    .build());
        }

        if (skipped > 0) {
            log.debug("跳过 {} 条无 IP 的发现记录", skipped);
        }
        return new DeviceRoster(devices);
    }

    public boolean isStale(Instant lastSeen, Instant now) {
        if (lastSeen == null || now == null) {
            return false;
        }
        return Duration.between(lastSeen, now).compareTo(offlineThreshold) > 0;
    }

    private Map<String, LeaseRecord> activeLeases(Collection<LeaseRecord> leaseRecords, Instant now) {
        Map<String, LeaseRecord> result = new LinkedHashMap<>();
        if (leaseRecords == null) {
            return result;
        }
        Set<String> expired = new HashSet<>();
        for (LeaseRecord lease : leaseRecords) {
            if (lease == null || lease.getIp() == null || lease.getIp().isBlank()) {
                continue;
            }
            String ip = lease.getIp().trim();
            if (lease.isActive(now)) {
                result.put(ip, lease);
            } else {
                expired.add(ip);
            }
        }
        if (!expired.isEmpty()) {
            log.debug("忽略 {} 条已过期租约", expired.size());
        }
        return result;
    }
}
