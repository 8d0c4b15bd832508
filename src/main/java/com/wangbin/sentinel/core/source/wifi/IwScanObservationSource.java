package com.wangbin.sentinel.core.source.wifi;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.sentinel.common.exception.SourceException;
import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.source.WifiObservationSource;
import com.wangbin.sentinel.core.wifi.ScanOutputParser;
import com.wangbin.sentinel.core.wifi.WifiNetworkObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;

/**
 * 通过 iwlist 扫描周边无线网络，失败或无结果时改用 iw 的扫描缓存。
 * 扫描代价较高，结果按配置的 TTL 缓存。
 */
@Slf4j
public class IwScanObservationSource implements WifiObservationSource {

    private static final String CACHE_KEY = "scan";

    private final SentinelProperties.WifiConfig config;
    private final CommandRunner runner;
    private final ScanOutputParser parser;
    private final Cache<String, List<WifiNetworkObservation>> cache;

    public IwScanObservationSource(SentinelProperties.WifiConfig config, CommandRunner runner, ScanOutputParser parser) {
        this.config = config;
        this.runner = runner;
        this.parser = parser;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(config.getScanCacheTtl())
                .build();
    }

    @Override
    public List<WifiNetworkObservation> observe() {
        if (!config.isScanEnabled()) {
            return Collections.emptyList();
        }
        List<WifiNetworkObservation> cached = cache.getIfPresent(CACHE_KEY);
        if (cached != null) {
            return cached;
        }
        List<WifiNetworkObservation> networks = scan();
        cache.put(CACHE_KEY, networks);
        return networks;
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    private List<WifiNetworkObservation> scan() {
        String iface = config.getScanInterface();
        long timeout = config.getScanTimeoutMs();

        SourceException iwlistFailure = null;
        try {
            List<WifiNetworkObservation> networks = parser.parseIwlist(runner.run(timeout, "iwlist", iface, "scan"));
            if (!networks.isEmpty()) {
                log.debug("iwlist 扫描到 {} 个网络", networks.size());
                return Collections.unmodifiableList(networks);
            }
        } catch (SourceException e) {
            iwlistFailure = e;
            log.debug("iwlist 扫描失败，改用 iw: {}", e.getMessage());
        }

        try {
            List<WifiNetworkObservation> networks = parser.parseIw(runner.run(timeout, "iw", iface, "scan", "dump"));
            log.debug("iw 扫描到 {} 个网络", networks.size());
            return Collections.unmodifiableList(networks);
        } catch (SourceException e) {
            if (iwlistFailure != null) {
                e.addSuppressed(iwlistFailure);
            }
            throw e;
        }
    }
}
