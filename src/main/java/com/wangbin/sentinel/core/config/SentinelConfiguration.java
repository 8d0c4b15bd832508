package com.wangbin.sentinel.core.config;

import com.wangbin.sentinel.core.analysis.AnalysisContext;
import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import com.wangbin.sentinel.core.health.AnalysisThresholds;
import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.history.HistoryTracker;
import com.wangbin.sentinel.core.log.LogBuffer;
import com.wangbin.sentinel.core.log.SyslogMessageParser;
import com.wangbin.sentinel.core.log.SyslogReceiver;
import com.wangbin.sentinel.core.source.BandwidthSource;
import com.wangbin.sentinel.core.source.DiscoverySource;
import com.wangbin.sentinel.core.source.LeaseSource;
import com.wangbin.sentinel.core.source.NetworkMetricsSource;
import com.wangbin.sentinel.core.source.WifiObservationSource;
import com.wangbin.sentinel.core.source.WifiStatsSource;
import com.wangbin.sentinel.core.source.lease.JsonLeaseSource;
import com.wangbin.sentinel.core.source.snmp.SnmpBandwidthSource;
import com.wangbin.sentinel.core.source.snmp.SnmpClient;
import com.wangbin.sentinel.core.source.snmp.SnmpDiscoverySource;
import com.wangbin.sentinel.core.source.stats.DefaultNetworkMetricsSource;
import com.wangbin.sentinel.core.source.stats.StaticWifiStatsSource;
import com.wangbin.sentinel.core.source.wifi.IwScanObservationSource;
import com.wangbin.sentinel.core.source.wifi.ProcessCommandRunner;
import com.wangbin.sentinel.core.wifi.ScanOutputParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;

/**
 * 数据源与分析组件装配
 */
@Slf4j
@Configuration
public class SentinelConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // =============== 数据源 ===============

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "sentinel.snmp", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SnmpClient snmpClient(SentinelProperties properties) {
        return new SnmpClient(properties.getSnmp());
    }

    @Bean
    public DiscoverySource discoverySource(ObjectProvider<SnmpClient> snmpClient,
                                           SentinelProperties properties,
                                           Clock clock) {
        SnmpClient client = snmpClient.getIfAvailable();
        if (client == null) {
            log.info("SNMP 未启用，设备发现返回空数据");
            return Collections::emptyList;
        }
        return new SnmpDiscoverySource(client, properties.getDiscovery(), clock);
    }

    @Bean
    public BandwidthSource bandwidthSource(ObjectProvider<SnmpClient> snmpClient, Clock clock) {
        SnmpClient client = snmpClient.getIfAvailable();
        if (client == null) {
            return () -> BandwidthSample.empty(clock.instant());
        }
        return new SnmpBandwidthSource(client, clock);
    }

    @Bean
    public JsonLeaseSource leaseSource(SentinelProperties properties) {
        return new JsonLeaseSource(Path.of(properties.getStorage().getLeaseFile()));
    }

    @Bean
    public WifiStatsSource wifiStatsSource(SentinelProperties properties) {
        return new StaticWifiStatsSource(properties.getWifi());
    }

    @Bean
    public NetworkMetricsSource networkMetricsSource(SentinelProperties properties) {
        return new DefaultNetworkMetricsSource(properties.getMetrics());
    }

    @Bean
    public WifiObservationSource wifiObservationSource(SentinelProperties properties) {
        return new IwScanObservationSource(properties.getWifi(), new ProcessCommandRunner(), new ScanOutputParser());
    }

    // =============== 分析 ===============

    @Bean
    public AnalysisOrchestrator analysisOrchestrator(SentinelProperties properties,
                                                     Clock clock,
                                                     DiscoverySource discoverySource,
                                                     LeaseSource leaseSource,
                                                     BandwidthSource bandwidthSource,
                                                     WifiStatsSource wifiStatsSource,
                                                     NetworkMetricsSource networkMetricsSource,
                                                     WifiObservationSource wifiObservationSource) {
        SentinelProperties.AnalysisConfig analysis = properties.getAnalysis();
        int capacity = analysis.getHistoryCapacity();
        if (capacity < 1) {
            log.warn("历史容量配置无效: {}，使用默认值 {}", capacity, HistoryTracker.DEFAULT_CAPACITY);
            capacity = HistoryTracker.DEFAULT_CAPACITY;
        }

        AnalysisContext context = AnalysisContext.builder()
                .discoverySource(discoverySource)
                .leaseSource(leaseSource)
                .bandwidthSource(bandwidthSource)
                .wifiStatsSource(wifiStatsSource)
                .metricsSource(networkMetricsSource)
                .wifiObservationSource(wifiObservationSource)
                .thresholds(AnalysisThresholds.from(analysis))
                .clock(clock)
                .repeatPolicy(analysis.getRepeatPolicy())
                .historyCapacity(capacity)
                .build();
        log.info("分析编排器初始化: 离线阈值 {}, 历史容量 {}, 重复问题策略 {}",
                context.getThresholds().getOfflineThreshold(), capacity, context.getRepeatPolicy());
        return new AnalysisOrchestrator(context);
    }

    // =============== 日志 ===============

    @Bean
    public LogBuffer logBuffer(SentinelProperties properties) {
        SentinelProperties.SyslogConfig syslog = properties.getSyslog();
        int size = syslog.getBufferSize() > 0 ? syslog.getBufferSize() : 10000;
        return new LogBuffer(size, syslog.getRetainOnTrim());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "sentinel.syslog", name = "enabled", havingValue = "true")
    public SyslogReceiver syslogReceiver(SentinelProperties properties, LogBuffer logBuffer, Clock clock) {
        return new SyslogReceiver(properties.getSyslog().getPort(), logBuffer, new SyslogMessageParser(), clock);
    }
}
