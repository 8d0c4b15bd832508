package com.wangbin.sentinel.core.health;

import com.wangbin.sentinel.core.device.Device;
import com.wangbin.sentinel.core.device.DeviceRoster;
import com.wangbin.sentinel.core.device.DeviceStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 健康指标聚合：名册 + 带宽 + 无线统计 + 网络质量 -> 摘要与问题列表。
 * <p>
 * 每条规则独立判定，同一指标的严重与告警互斥；没有触发任何规则时输出一条 healthy 信息。
 * 任一输入缺失时按空数据处理。
 */
@Slf4j
public class HealthMetricsAggregator {

    static final int OFFLINE_IPS_IN_DESCRIPTION = 5;

    public HealthAnalysis analyze(DeviceRoster roster,
                                  BandwidthSample bandwidth,
                                  WifiStats wifiStats,
                                  NetworkMetricsSample metrics,
                                  AnalysisThresholds thresholds,
                                  Instant timestamp) {
        DeviceRoster safeRoster = roster != null ? roster : DeviceRoster.empty();
        BandwidthSample safeBandwidth = bandwidth != null ? bandwidth : BandwidthSample.empty(timestamp);
        WifiStats safeWifi = wifiStats != null ? wifiStats : WifiStats.empty();
        NetworkMetricsSample safeMetrics = metrics != null ? metrics : NetworkMetricsSample.empty();
        AnalysisThresholds safeThresholds = thresholds != null ? thresholds : AnalysisThresholds.defaults();

        List<Issue> issues = detectIssues(safeRoster, safeMetrics, safeWifi, safeThresholds);
        HealthSummary summary = buildSummary(safeRoster, safeBandwidth, safeWifi, safeMetrics, issues, timestamp);
        return HealthAnalysis.builder()
                .summary(summary)
                .issues(issues)
                .build();
    }

    List<Issue> detectIssues(DeviceRoster roster,
                             NetworkMetricsSample metrics,
                             WifiStats wifiStats,
                             AnalysisThresholds thresholds) {
        List<Issue> issues = new ArrayList<>();

        // 1. 离线设备
        List<Device> offlineDevices = roster.byStatus(DeviceStatus.OFFLINE);
        if (!offlineDevices.isEmpty()) {
            List<String> ips = offlineDevices.stream().map(Device::getIp).collect(Collectors.toUnmodifiableList());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("ips", ips);
            issues.add(Issue.builder()
                    .severity(IssueSeverity.WARNING)
                    .type(IssueType.DEVICE_OFFLINE)
                    .title(offlineDevices.size() + " 台设备离线")
                    .description("离线设备: " + String.join(", ",
                            ips.subList(0, Math.min(OFFLINE_IPS_IN_DESCRIPTION, ips.size()))))
                    .recommendation("检查设备电源和网络连接")
                    .details(details)
                    .build());
        }

        // 2. 丢包
        double packetLoss = metrics.getPacketLossPercent();
        if (packetLoss >= thresholds.getPacketLossCritical()) {
            issues.add(Issue.builder()
                    .severity(IssueSeverity.CRITICAL)
                    .type(IssueType.PACKET_LOSS)
                    .title("丢包率过高: " + packetLoss + "%")
                    .description("当前丢包率 " + packetLoss + "%")
                    .recommendation("检查网络拥塞或物理连接")
                    .build());
        } else if (packetLoss >= thresholds.getPacketLossWarning()) {
            issues.add(Issue.builder()
                    .severity(IssueSeverity.WARNING)
                    .type(IssueType.PACKET_LOSS)
                    .title("丢包率偏高: " + packetLoss + "%")
                    .description("当前丢包率 " + packetLoss + "%")
                    .recommendation("监控趋势，检查网络负载")
                    .build());
        }

        // 3. 延迟
        double avgLatency = metrics.getAvgLatencyMs();
        if (avgLatency >= thresholds.getLatencyCriticalMs()) {
            issues.add(Issue.builder()
                    .severity(IssueSeverity.CRITICAL)
                    .type(IssueType.LATENCY)
                    .title("延迟过高: " + avgLatency + "ms")
                    .description("平均延迟 " + avgLatency + "ms")
                    .recommendation("检查网络拥塞或设备负载")
                    .build());
        } else if (avgLatency >= thresholds.getLatencyWarningMs()) {
            issues.add(Issue.builder()
                    .severity(IssueSeverity.WARNING)
                    .type(IssueType.LATENCY)
                    .title("延迟偏高: " + avgLatency + "ms")
                    .description("平均延迟 " + avgLatency + "ms")
                    .recommendation("持续监控")
                    .build());
        }

        // 4. WiFi 客户端过多
        int totalClients = wifiStats.getTotalClients();
        if (totalClients > thresholds.getWifiClientLimit()) {
            issues.add(Issue.builder()
                    .severity(IssueSeverity.WARNING)
                    .type(IssueType.WIFI_CONGESTION)
                    .title("WiFi 设备过多: " + totalClients)
                    .description("当前 " + totalClients + " 个 WiFi 设备连接")
                    .recommendation("考虑增加 AP 或负载均衡")
                    .build());
        }

        // 5. 无问题时补一条正常状态
        if (issues.isEmpty()) {
            issues.add(healthyIssue());
        }

        if (log.isDebugEnabled()) {
            log.debug("问题检测完成: {}", issues.stream().map(Issue::signature).collect(Collectors.toList()));
        }
        return Collections.unmodifiableList(issues);
    }

    HealthSummary buildSummary(DeviceRoster roster,
                               BandwidthSample bandwidth,
                               WifiStats wifiStats,
                               NetworkMetricsSample metrics,
                               List<Issue> issues,
                               Instant timestamp) {
        List<String> offlineIps = roster.offlineIps();

        return HealthSummary.builder()
                .timestamp(timestamp)
                .totalDevices(roster.getTotal())
                .onlineDevices(roster.getOnline())
                .offlineDevices(roster.getOffline())
                .unknownDevices(roster.getUnknown())
                .offlineList(offlineIps)
                .packetLoss(metrics.getPacketLossPercent())
                .avgLatencyMs(metrics.getAvgLatencyMs())
                .wifiClients(wifiStats.getTotalClients())
                .bandwidthInMbps(bandwidth.getInMbps())
                .bandwidthOutMbps(bandwidth.getOutMbps())
                .alerts(buildAlerts(issues, offlineIps.size()))
                .build();
    }

    static List<String> buildAlerts(List<Issue> issues, int offlineCount) {
        long critical = issues.stream().filter(i -> i.getSeverity() == IssueSeverity.CRITICAL).count();
        long warning = issues.stream().filter(i -> i.getSeverity() == IssueSeverity.WARNING).count();

        List<String> alerts = new ArrayList<>();
        if (critical > 0) {
            alerts.add(critical + " 个严重问题需要处理");
        }
        if (warning > 0) {
            alerts.add(warning + " 个警告");
        }
        if (offlineCount > 0) {
            alerts.add(offlineCount + " 台设备离线");
        }
        if (alerts.isEmpty()) {
            alerts.add("网络运行正常");
        }
        return Collections.unmodifiableList(alerts);
    }

    static Issue healthyIssue() {
        return Issue.builder()
                .severity(IssueSeverity.INFO)
                .type(IssueType.HEALTHY)
                .title("网络运行正常")
                .description("所有指标正常")
                .recommendation("保持当前状态")
                .build();
    }
}
