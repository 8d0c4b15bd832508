package com.wangbin.sentinel.core.history;

import com.google.common.collect.EvictingQueue;
import com.wangbin.sentinel.core.health.HealthSummary;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 有界的摘要历史，按时间顺序保存，超出容量时淘汰最旧的记录。
 * <p>
 * 写入（追加 + 淘汰）与读取互斥，读方总是看到追加前或追加后的完整状态。
 */
public class HistoryTracker {

    public static final int DEFAULT_CAPACITY = 288;

    @Getter
    private final int capacity;
    private final Clock clock;
    private final EvictingQueue<HealthSummary> entries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public HistoryTracker(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("历史容量必须大于 0: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.entries = EvictingQueue.create(capacity);
    }

    public void append(HealthSummary summary) {
        if (summary == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            entries.add(summary);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 当前历史的不可变副本，按时间从旧到新
     */
    public List<HealthSummary> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<HealthSummary> latest() {
        List<HealthSummary> copy = snapshot();
        return copy.isEmpty() ? Optional.empty() : Optional.of(copy.get(copy.size() - 1));
    }

    public TrendReport trend(int windowHours) {
        if (windowHours <= 0) {
            return TrendReport.noData(windowHours);
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(windowHours));
        List<HealthSummary> recent = snapshot().stream()
                .filter(summary -> summary.getTimestamp() != null && summary.getTimestamp().isAfter(cutoff))
                .collect(Collectors.toList());

        if (recent.isEmpty()) {
            return TrendReport.noData(windowHours);
        }

        Map<String, MetricTrend> metrics = new LinkedHashMap<>();
        for (TrendMetric metric : TrendMetric.values()) {
            metrics.put(metric.getCode(), computeTrend(recent, metric));
        }
        return TrendReport.builder()
                .periodHours(windowHours)
                .dataPoints(recent.size())
                .metrics(metrics)
                .build();
    }

    static MetricTrend computeTrend(List<HealthSummary> recent, TrendMetric metric) {
        double[] values = recent.stream().mapToDouble(metric::valueOf).toArray();

        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            sum += value;
            max = Math.max(max, value);
            min = Math.min(min, value);
        }

        // 前半段取 size/2 条，奇数时后半段多一条
        TrendDirection direction = TrendDirection.STABLE;
        if (values.length >= 2) {
            int mid = values.length / 2;
            direction = TrendDirection.compare(average(values, 0, mid), average(values, mid, values.length));
        }

        return MetricTrend.builder()
                .avg(sum / values.length)
                .max(max)
                .min(min)
                .trend(direction)
                .build();
    }

    private static double average(double[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
