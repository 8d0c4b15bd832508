package com.wangbin.sentinel.core.source.snmp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.device.DiscoveryRecord;
import com.wangbin.sentinel.core.source.DiscoverySource;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.smi.VariableBinding;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 通过路由器 ARP 表（ipNetToMediaPhysAddress）发现设备。
 * <p>
 * 每次 walk 到的条目刷新 lastSeen；本次未出现的设备保留上一次的记录，
 * 由注册表按离线阈值判定为 offline，超过保留时长后从缓存中淘汰。
 */
@Slf4j
public class SnmpDiscoverySource implements DiscoverySource {

    static final String ARP_PHYS_ADDRESS_OID = "1.3.6.1.2.1.4.22.1.2";

    private final SnmpWalker walker;
    private final Clock clock;
    private final Cache<String, DiscoveryRecord> sightings;

    public SnmpDiscoverySource(SnmpWalker walker, SentinelProperties.DiscoveryConfig config, Clock clock) {
        this.walker = walker;
        this.clock = clock;
        this.sightings = Caffeine.newBuilder()
                .maximumSize(config.getMaxSightings())
                .expireAfterWrite(config.getSightingRetention())
                .build();
    }

    @Override
    public List<DiscoveryRecord> discover() {
        Instant now = clock.instant();
        List<VariableBinding> bindings = walker.walk(ARP_PHYS_ADDRESS_OID);

        int seen = 0;
        for (VariableBinding vb : bindings) {
            // 索引为 ifIndex.a.b.c.d
            String ip = SnmpValues.lastSubIds(vb.getOid(), 4);
            if (ip == null || ip.startsWith("0.")) {
                continue;
            }
            String mac = SnmpValues.toMac(vb.getVariable());
            DiscoveryRecord previous = sightings.getIfPresent(ip);
            Instant firstSeen = previous != null && previous.getFirstSeen() != null ? previous.getFirstSeen() : now;
            sightings.put(ip, DiscoveryRecord.builder()
                    .ip(ip)
                    .mac(mac)
                    .firstSeen(firstSeen)
                    .lastSeen(now)
                    .build());
            seen++;
        }

        List<DiscoveryRecord> records = new ArrayList<>(sightings.asMap().values());
        records.sort(Comparator.comparing(DiscoveryRecord::getIp));
        log.debug("ARP 发现 {} 台设备, 累计记录 {} 条", seen, records.size());
        return records;
    }
}
