package com.wangbin.sentinel.core.config;

import com.wangbin.sentinel.core.health.IssueRepeatPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * sentinel.* 配置映射
 */
@Data
@Component
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    /**
     * 分析阈值与调度
     */
    private AnalysisConfig analysis = new AnalysisConfig();

    /**
     * 路由器 SNMP 访问
     */
    private SnmpConfig snmp = new SnmpConfig();

    /**
     * 设备发现
     */
    private DiscoveryConfig discovery = new DiscoveryConfig();

    /**
     * 本地存储（租约缓存等）
     */
    private StorageConfig storage = new StorageConfig();

    /**
     * 无线统计与扫描
     */
    private WifiConfig wifi = new WifiConfig();

    /**
     * 网络质量基线
     */
    private MetricsConfig metrics = new MetricsConfig();

    /**
     * Syslog 接收
     */
    private SyslogConfig syslog = new SyslogConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class AnalysisConfig {
        /**
         * 超过该时长未出现的设备判定为离线
         */
        private Duration offlineThreshold = Duration.ofMinutes(30);
        private double packetLossWarning = 1.0;
        private double packetLossCritical = 5.0;
        private double latencyWarningMs = 100;
        private double latencyCriticalMs = 500;
        private int wifiClientLimit = 100;
        /**
         * 定时分析间隔
         */
        private Duration interval = Duration.ofSeconds(300);
        private boolean scheduleEnabled = true;
        /**
         * 历史容量，默认 288（5 分钟一次，约 24 小时）
         */
        private int historyCapacity = 288;
        private IssueRepeatPolicy repeatPolicy = IssueRepeatPolicy.REPEAT;

        /**
         * 调度使用的间隔毫秒数，配置非正数时回退到 300 秒
         */
        public long getIntervalMillis() {
            return interval != null && !interval.isNegative() && !interval.isZero()
                    ? interval.toMillis() : 300_000L;
        }
    }

    @Data
    public static class SnmpConfig {
        private boolean enabled = true;
        private String host = "192.168.100.1";
        private int port = 161;
        private String community = "public";
        private String version = "2c";
        private long timeoutMs = 5000;
        private int retries = 3;
    }

    @Data
    public static class DiscoveryConfig {
        /**
         * 设备出现记录保留时长，超过后不再出现在名册中
         */
        private Duration sightingRetention = Duration.ofHours(24);
        private int maxSightings = 4096;
    }

    @Data
    public static class StorageConfig {
        private String leaseFile = "/data/sentinel/dhcp_leases.json";
    }

    @Data
    public static class WifiConfig {
        private String scanInterface = "wlan0";
        private boolean scanEnabled = true;
        private long scanTimeoutMs = 30000;
        private Duration scanCacheTtl = Duration.ofSeconds(60);
        /**
         * 静态 AP 客户端统计，路由器未提供无线 MIB 时使用
         */
        private List<AccessPoint> accessPoints = new ArrayList<>();
    }

    @Data
    public static class AccessPoint {
        private String name;
        private String band;
        private int clients;
        private int channel;
    }

    @Data
    public static class MetricsConfig {
        private double packetLossPercent = 0.0;
        private double avgLatencyMs = 0.0;
        private double maxLatencyMs = 0.0;
        private double jitterMs = 0.0;
        private long tcpRetries = 0;
        private long udpErrors = 0;
    }

    @Data
    public static class SyslogConfig {
        private boolean enabled = false;
        private int port = 5514;
        private int bufferSize = 10000;
        /**
         * 缓冲区溢出后保留的条数
         */
        private int retainOnTrim = 5000;
    }
}
