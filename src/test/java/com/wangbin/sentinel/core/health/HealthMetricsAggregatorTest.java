package com.wangbin.sentinel.core.health;

import com.wangbin.sentinel.core.device.DeviceRegistry;
import com.wangbin.sentinel.core.device.DeviceRoster;
import com.wangbin.sentinel.core.device.DiscoveryRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HealthMetricsAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final HealthMetricsAggregator aggregator = new HealthMetricsAggregator();

    @Test
    void allNormalGivesSingleHealthyIssue() {
        HealthAnalysis analysis = aggregator.analyze(DeviceRoster.empty(), BandwidthSample.empty(NOW),
                WifiStats.empty(), NetworkMetricsSample.empty(), AnalysisThresholds.defaults(), NOW);

        assertEquals(1, analysis.getIssues().size());
        Issue issue = analysis.getIssues().get(0);
        assertEquals(IssueType.HEALTHY, issue.getType());
        assertEquals(IssueSeverity.INFO, issue.getSeverity());
        assertEquals(List.of("网络运行正常"), analysis.getSummary().getAlerts());
    }

    @Test
    void criticalPacketLossExcludesWarning() {
        NetworkMetricsSample metrics = NetworkMetricsSample.builder().packetLossPercent(6.0).build();

        List<Issue> issues = aggregator.analyze(null, null, null, metrics, null, NOW).getIssues();

        List<Issue> lossIssues = issues.stream()
                .filter(issue -> issue.getType() == IssueType.PACKET_LOSS)
                .collect(Collectors.toList());
        assertEquals(1, lossIssues.size());
        assertEquals(IssueSeverity.CRITICAL, lossIssues.get(0).getSeverity());
        assertTrue(issues.stream().noneMatch(issue -> issue.getType() == IssueType.HEALTHY));
    }

    @Test
    void warningLevelLatency() {
        NetworkMetricsSample metrics = NetworkMetricsSample.builder().avgLatencyMs(150).build();

        List<Issue> issues = aggregator.analyze(null, null, null, metrics, AnalysisThresholds.defaults(), NOW).getIssues();

        assertEquals(1, issues.size());
        assertEquals(IssueType.LATENCY, issues.get(0).getType());
        assertEquals(IssueSeverity.WARNING, issues.get(0).getSeverity());
    }

    @Test
    void packetLossAtCriticalThresholdIsCritical() {
        assertSingleIssue(NetworkMetricsSample.builder().packetLossPercent(5.0).build(), null,
                IssueType.PACKET_LOSS, IssueSeverity.CRITICAL);
    }

    @Test
    void packetLossAtWarningThresholdIsWarning() {
        assertSingleIssue(NetworkMetricsSample.builder().packetLossPercent(1.0).build(), null,
                IssueType.PACKET_LOSS, IssueSeverity.WARNING);
    }

    @Test
    void latencyAtCriticalThresholdIsCritical() {
        assertSingleIssue(NetworkMetricsSample.builder().avgLatencyMs(500).build(), null,
                IssueType.LATENCY, IssueSeverity.CRITICAL);
    }

    @Test
    void latencyAtWarningThresholdIsWarning() {
        assertSingleIssue(NetworkMetricsSample.builder().avgLatencyMs(100).build(), null,
                IssueType.LATENCY, IssueSeverity.WARNING);
    }

    @Test
    void valuesJustBelowThresholdsAreHealthy() {
        NetworkMetricsSample metrics = NetworkMetricsSample.builder().packetLossPercent(0.99).avgLatencyMs(99.9).build();
        WifiStats stats = WifiStats.builder().totalClients(100).build();

        assertSingleIssue(metrics, stats, IssueType.HEALTHY, IssueSeverity.INFO);
    }

    @Test
    void wifiClientLimitIsExclusive() {
        assertSingleIssue(null, WifiStats.builder().totalClients(101).build(),
                IssueType.WIFI_CONGESTION, IssueSeverity.WARNING);
    }

    @Test
    void offlineIssueDetailsHoldReadOnlyIpList() {
        List<DiscoveryRecord> records = List.of(
                DiscoveryRecord.builder().ip("10.0.0.5").lastSeen(NOW.minus(Duration.ofHours(2))).build());
        DeviceRoster roster = new DeviceRegistry(Duration.ofMinutes(30)).refresh(records, null, NOW);

        HealthAnalysis analysis = aggregator.analyze(roster, null, null, null, null, NOW);

        Map<String, Object> details = analysis.getIssues().get(0).getDetails();
        assertEquals(List.of("ips"), List.copyOf(details.keySet()));
        assertEquals(List.of("10.0.0.5"), details.get("ips"));
        assertThrows(UnsupportedOperationException.class, () -> details.put("devices", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> analysis.getSummary().getOfflineList().add("10.0.0.6"));
    }

    @Test
    void offlineDevicesListUpToFiveIpsInDescription() {
        List<DiscoveryRecord> records = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            records.add(DiscoveryRecord.builder().ip("10.0.0." + i).lastSeen(NOW.minus(Duration.ofHours(2))).build());
        }
        DeviceRoster roster = new DeviceRegistry(Duration.ofMinutes(30)).refresh(records, null, NOW);

        HealthAnalysis analysis = aggregator.analyze(roster, null, null, null, null, NOW);

        Issue offline = analysis.getIssues().get(0);
        assertEquals(IssueType.DEVICE_OFFLINE, offline.getType());
        assertEquals(IssueSeverity.WARNING, offline.getSeverity());
        assertTrue(offline.getDescription().contains("10.0.0.5"));
        assertFalse(offline.getDescription().contains("10.0.0.6"));
        assertEquals(7, ((List<?>) offline.getDetails().get("ips")).size());

        HealthSummary summary = analysis.getSummary();
        assertEquals(7, summary.getOfflineDevices());
        assertEquals(7, summary.getOfflineList().size());
        assertEquals(List.of("1 个警告", "7 台设备离线"), summary.getAlerts());
    }

    @Test
    void tooManyWifiClientsIsCongestion() {
        WifiStats stats = WifiStats.builder().band2gClients(60).band5gClients(41).totalClients(101).build();

        List<Issue> issues = aggregator.analyze(null, null, stats, null, null, NOW).getIssues();

        assertEquals(IssueType.WIFI_CONGESTION, issues.get(0).getType());
    }

    @Test
    void summaryCopiesInputs() {
        BandwidthSample bandwidth = BandwidthSample.builder().inMbps(12.5).outMbps(3.25).timestamp(NOW).build();
        NetworkMetricsSample metrics = NetworkMetricsSample.builder().packetLossPercent(0.5).avgLatencyMs(20).build();
        WifiStats stats = WifiStats.builder().totalClients(8).build();

        HealthSummary summary = aggregator.analyze(DeviceRoster.empty(), bandwidth, stats, metrics, null, NOW).getSummary();

        assertEquals(NOW, summary.getTimestamp());
        assertEquals(12.5, summary.getBandwidthInMbps());
        assertEquals(3.25, summary.getBandwidthOutMbps());
        assertEquals(0.5, summary.getPacketLoss());
        assertEquals(20, summary.getAvgLatencyMs());
        assertEquals(8, summary.getWifiClients());
    }

    @Test
    void alertCountsBySeverity() {
        List<Issue> issues = List.of(
                Issue.builder().severity(IssueSeverity.CRITICAL).type(IssueType.PACKET_LOSS).title("a").build(),
                Issue.builder().severity(IssueSeverity.CRITICAL).type(IssueType.LATENCY).title("b").build(),
                Issue.builder().severity(IssueSeverity.WARNING).type(IssueType.WIFI_CONGESTION).title("c").build());

        assertEquals(List.of("2 个严重问题需要处理", "1 个警告"), HealthMetricsAggregator.buildAlerts(issues, 0));
    }

    private void assertSingleIssue(NetworkMetricsSample metrics, WifiStats stats, IssueType type, IssueSeverity severity) {
        List<Issue> issues = aggregator.analyze(DeviceRoster.empty(), null, stats, metrics,
                AnalysisThresholds.defaults(), NOW).getIssues();

        assertEquals(1, issues.size(), () -> "issues: " + issues);
        assertEquals(type, issues.get(0).getType());
        assertEquals(severity, issues.get(0).getSeverity());
    }
}
