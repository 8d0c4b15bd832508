package com.wangbin.sentinel.core.source.snmp;

import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.source.BandwidthSource;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.VariableBinding;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通过 ifTable 的 ifInOctets/ifOutOctets 计算总带宽，忽略回环与容器网桥接口。
 */
@Slf4j
public class SnmpBandwidthSource implements BandwidthSource {

    static final String IF_TABLE_OID = "1.3.6.1.2.1.2.2.1";
    static final int IF_DESCR = 2;
    static final int IF_IN_OCTETS = 10;
    static final int IF_OUT_OCTETS = 16;

    private static final String[] IGNORED_PREFIXES = {"lo", "docker", "br-", "veth"};

    private final SnmpWalker walker;
    private final Clock clock;
    private final InterfaceCounterTracker tracker = new InterfaceCounterTracker();

    public SnmpBandwidthSource(SnmpWalker walker, Clock clock) {
        this.walker = walker;
        this.clock = clock;
    }

    @Override
    public BandwidthSample sample() {
        Instant now = clock.instant();
        Map<String, long[]> counters = readCounters(walker.walk(IF_TABLE_OID));
        double[] rates = tracker.update(counters, now);
        log.debug("接口 {} 个, 入 {} Mbps, 出 {} Mbps", counters.size(), rates[0], rates[1]);
        return BandwidthSample.builder()
                .inMbps(rates[0])
                .outMbps(rates[1])
                .timestamp(now)
                .build();
    }

    static Map<String, long[]> readCounters(List<VariableBinding> bindings) {
        Map<Integer, String> names = new HashMap<>();
        Map<Integer, long[]> byIndex = new LinkedHashMap<>();

        for (VariableBinding vb : bindings) {
            OID oid = vb.getOid();
            if (oid == null || oid.size() < 2) {
                continue;
            }
            int attribute = oid.get(oid.size() - 2);
            int index = oid.get(oid.size() - 1);
            switch (attribute) {
                case IF_DESCR -> names.put(index, SnmpValues.toText(vb.getVariable()));
                case IF_IN_OCTETS -> byIndex.computeIfAbsent(index, k -> new long[2])[0] = SnmpValues.toLong(vb.getVariable());
                case IF_OUT_OCTETS -> byIndex.computeIfAbsent(index, k -> new long[2])[1] = SnmpValues.toLong(vb.getVariable());
                default -> {
                }
            }
        }

        Map<String, long[]> counters = new LinkedHashMap<>();
        byIndex.forEach((index, values) -> {
            String name = names.getOrDefault(index, "if" + index);
            if (!isIgnored(name)) {
                counters.put(name, values);
            }
        });
        return counters;
    }

    static boolean isIgnored(String name) {
        for (String prefix : IGNORED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
