package com.wangbin.sentinel.core.source.wifi;

import com.wangbin.sentinel.common.exception.SourceException;
import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.wifi.ScanOutputParser;
import com.wangbin.sentinel.core.wifi.WifiNetworkObservation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IwScanObservationSourceTest {

    private static final String IW_OUTPUT = String.join("\n",
            "BSS 00:11:22:33:44:55(on wlan0)",
            "\tfreq: 2437",
            "\tsignal: -61.00 dBm",
            "\tSSID: Office");

    private final SentinelProperties.WifiConfig config = new SentinelProperties.WifiConfig();

    @Test
    void fallsBackToIwWhenIwlistFails() {
        List<String> commands = new ArrayList<>();
        CommandRunner runner = (timeout, command) -> {
            commands.add(command[0]);
            if ("iwlist".equals(command[0])) {
                throw SourceException.scan("iwlist missing");
            }
            return IW_OUTPUT;
        };

        List<WifiNetworkObservation> networks = new IwScanObservationSource(config, runner, new ScanOutputParser()).observe();

        assertEquals(List.of("iwlist", "iw"), commands);
        assertEquals(1, networks.size());
        assertEquals("Office", networks.get(0).getSsid());
        assertEquals(6, networks.get(0).getChannel());
    }

    @Test
    void resultIsCachedUntilInvalidated() {
        int[] calls = {0};
        CommandRunner runner = (timeout, command) -> {
            calls[0]++;
            return "iw".equals(command[0]) ? IW_OUTPUT : "";
        };
        IwScanObservationSource source = new IwScanObservationSource(config, runner, new ScanOutputParser());

        source.observe();
        source.observe();
        assertEquals(2, calls[0]);

        source.invalidate();
        source.observe();
        assertEquals(4, calls[0]);
    }

    @Test
    void bothCommandsFailingPropagates() {
        CommandRunner runner = (timeout, command) -> {
            throw SourceException.scan(command[0] + " failed");
        };
        IwScanObservationSource source = new IwScanObservationSource(config, runner, new ScanOutputParser());

        SourceException error = assertThrows(SourceException.class, source::observe);
        assertEquals(1, error.getSuppressed().length);
    }

    @Test
    void disabledScanReturnsNothing() {
        config.setScanEnabled(false);
        CommandRunner runner = (timeout, command) -> fail("scan should not run");

        assertTrue(new IwScanObservationSource(config, runner, new ScanOutputParser()).observe().isEmpty());
    }
}
