package com.wangbin.sentinel.core.source.snmp;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 接口字节计数器跟踪，把两次采样之间的增量换算为 Mbps。
 * 首次采样没有基准，速率为 0。
 */
public class InterfaceCounterTracker {

    static final long COUNTER32_MAX = 0xFFFFFFFFL;

    private final Map<String, long[]> previousCounters = new HashMap<>();
    private Instant previousTime;

    /**
     * @param counters 接口名 -> {inOctets, outOctets}
     * @return {inMbps, outMbps}
     */
    public synchronized double[] update(Map<String, long[]> counters, Instant now) {
        double seconds = previousTime == null ? 0 : Duration.between(previousTime, now).toMillis() / 1000.0;
        long inDelta = 0;
        long outDelta = 0;
        boolean hasBaseline = previousTime != null && seconds > 0;

        for (Map.Entry<String, long[]> entry : counters.entrySet()) {
            long[] previous = previousCounters.get(entry.getKey());
            if (hasBaseline && previous != null) {
                inDelta += delta(previous[0], entry.getValue()[0]);
                outDelta += delta(previous[1], entry.getValue()[1]);
            }
        }

        previousCounters.clear();
        previousCounters.putAll(counters);
        previousTime = now;

        if (!hasBaseline) {
            return new double[]{0, 0};
        }
        return new double[]{toMbps(inDelta, seconds), toMbps(outDelta, seconds)};
    }

    static long delta(long previous, long current) {
        if (current >= previous) {
            return current - previous;
        }
        // 32 位计数器回绕；64 位计数器或设备重启按 0 处理
        if (previous <= COUNTER32_MAX) {
            return COUNTER32_MAX - previous + current + 1;
        }
        return 0;
    }

    private static double toMbps(long bytes, double seconds) {
        double mbps = bytes * 8 / seconds / 1_000_000;
        return Math.round(mbps * 100) / 100.0;
    }
}
