package com.wangbin.sentinel.core.analysis;

import com.wangbin.sentinel.core.device.DeviceDetails;
import com.wangbin.sentinel.core.device.DeviceRegistry;
import com.wangbin.sentinel.core.device.DeviceRoster;
import com.wangbin.sentinel.core.device.DiscoveryRecord;
import com.wangbin.sentinel.core.device.LeaseRecord;
import com.wangbin.sentinel.core.device.OfflineDeviceReport;
import com.wangbin.sentinel.core.health.AnalysisThresholds;
import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.health.HealthAnalysis;
import com.wangbin.sentinel.core.health.HealthMetricsAggregator;
import com.wangbin.sentinel.core.health.Issue;
import com.wangbin.sentinel.core.health.IssueRepeatFilter;
import com.wangbin.sentinel.core.health.NetworkMetricsSample;
import com.wangbin.sentinel.core.health.WifiStats;
import com.wangbin.sentinel.core.history.HistoryTracker;
import com.wangbin.sentinel.core.history.TrendReport;
import com.wangbin.sentinel.core.wifi.ChannelAnalyzer;
import com.wangbin.sentinel.core.wifi.ChannelCongestionScorer;
import com.wangbin.sentinel.core.wifi.ChannelReport;
import com.wangbin.sentinel.core.wifi.WifiNetworkObservation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 分析周期编排：采集 -> 名册 -> 健康聚合 -> 重复问题处理 -> 写入历史。
 * <p>
 * 同一时刻只执行一个周期；周期进行中到达的调用等待其结束并直接返回该周期的结果。
 * 每个数据源独立隔离，失败时记录告警并以空数据继续。
 */
@Slf4j
public class AnalysisOrchestrator {

    @Getter
    private final AnalysisContext context;
    private final AnalysisThresholds thresholds;
    private final Clock clock;
    private final DeviceRegistry registry;
    private final HealthMetricsAggregator aggregator = new HealthMetricsAggregator();
    private final IssueRepeatFilter repeatFilter;
    private final ChannelAnalyzer channelAnalyzer = new ChannelAnalyzer(new ChannelCongestionScorer());
    @Getter
    private final HistoryTracker history;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong completedCycles = new AtomicLong();

    private volatile AnalysisResult latestResult;
    private volatile DeviceRoster latestRoster = DeviceRoster.empty();

    public AnalysisOrchestrator(AnalysisContext context) {
        this.context = context;
        this.thresholds = context.getThresholds().sanitize();
        this.clock = context.getClock();
        this.registry = new DeviceRegistry(thresholds.getOfflineThreshold());
        this.repeatFilter = new IssueRepeatFilter(context.getRepeatPolicy());
        this.history = new HistoryTracker(context.getHistoryCapacity(), clock);
    }

    /**
     * 执行一次完整分析并写入历史。
     *
     * @throws CycleInterruptedException 线程在写入历史前被中断
     */
    public AnalysisResult runCycle() {
        long observed = completedCycles.get();
        try {
            cycleLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CycleInterruptedException("等待分析周期时被中断");
        }
        try {
            AnalysisResult current = latestResult;
            if (completedCycles.get() != observed && current != null) {
                log.debug("复用刚完成的分析周期结果 {}", current.getTimestamp());
                return current;
            }
            return executeCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    private AnalysisResult executeCycle() {
        long start = System.currentTimeMillis();
        Instant now = clock.instant();
        List<String> degraded = new ArrayList<>();

        DeviceRoster roster = buildRoster(now, degraded);
        BandwidthSample bandwidth = fetch("bandwidth", context.getBandwidthSource()::sample,
                () -> BandwidthSample.empty(now), degraded);
        WifiStats wifiStats = fetch("wifi-stats", context.getWifiStatsSource()::stats, WifiStats::empty, degraded);
        NetworkMetricsSample metrics = fetch("network-metrics", context.getMetricsSource()::sample,
                NetworkMetricsSample::empty, degraded);

        HealthAnalysis analysis = aggregator.analyze(roster, bandwidth, wifiStats, metrics, thresholds, now);

        if (Thread.currentThread().isInterrupted()) {
            log.warn("分析周期 {} 被中断，放弃本次结果", now);
            throw new CycleInterruptedException("分析周期被中断");
        }

        List<Issue> issues = repeatFilter.apply(analysis.getIssues());
        history.append(analysis.getSummary());

        AnalysisResult result = AnalysisResult.builder()
                .timestamp(now)
                .summary(analysis.getSummary())
                .issues(issues)
                .roster(roster)
                .bandwidth(bandwidth)
                .wifiStats(wifiStats)
                .metrics(metrics)
                .degradedSources(Collections.unmodifiableList(degraded))
                .durationMs(System.currentTimeMillis() - start)
                .build();
        latestRoster = roster;
        latestResult = result;
        completedCycles.incrementAndGet();

        log.info("分析周期完成: 设备 {} (离线 {}), 问题 {} 条, 降级数据源 {}, 耗时 {}ms",
                roster.getTotal(), roster.getOffline(), issues.size(), degraded, result.getDurationMs());
        return result;
    }

    /**
     * 只刷新设备名册，不做健康分析，也不写历史
     */
    public DeviceRoster refreshRoster() {
        try {
            cycleLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CycleInterruptedException("等待名册刷新时被中断");
        }
        try {
            DeviceRoster roster = buildRoster(clock.instant(), new ArrayList<>());
            latestRoster = roster;
            return roster;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<AnalysisResult> latestResult() {
        return Optional.ofNullable(latestResult);
    }

    /**
     * 最近一次结果，尚未执行过分析时先执行一次
     */
    public AnalysisResult currentResult() {
        AnalysisResult current = latestResult;
        return current != null ? current : runCycle();
    }

    public DeviceRoster latestRoster() {
        return latestRoster;
    }

    public TrendReport trends(int hours) {
        return history.trend(hours);
    }

    public Optional<DeviceDetails> deviceDetails(String ip) {
        return latestRoster.find(ip).map(device -> DeviceDetails.of(device, clock.instant()));
    }

    public OfflineDeviceReport offlineReport() {
        return OfflineDeviceReport.from(latestRoster);
    }

    /**
     * 扫描周边网络并生成信道报告，扫描失败时异常直接抛给调用方
     */
    public ChannelReport channelReport() {
        List<WifiNetworkObservation> observations = context.getWifiObservationSource().observe();
        return channelAnalyzer.analyze(observations != null ? observations : Collections.emptyList(), clock.instant());
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }

    public Duration getOfflineThreshold() {
        return registry.getOfflineThreshold();
    }

    private DeviceRoster buildRoster(Instant now, List<String> degraded) {
        List<DiscoveryRecord> discovered = fetch("discovery", context.getDiscoverySource()::discover,
                Collections::emptyList, degraded);
        List<LeaseRecord> leases = fetch("dhcp-lease", context.getLeaseSource()::leases,
                Collections::emptyList, degraded);
        return registry.refresh(discovered, leases, now);
    }

    private <T> T fetch(String name, Supplier<T> call, Supplier<T> fallback, List<String> degraded) {
        try {
            T value = call.get();
            if (value != null) {
                return value;
            }
            log.warn("数据源 {} 未返回数据，使用空数据", name);
        } catch (RuntimeException e) {
            log.warn("数据源 {} 读取失败，使用空数据: {}", name, e.getMessage());
            log.debug("数据源 {} 异常详情", name, e);
        }
        degraded.add(name);
        return fallback.get();
    }
}
