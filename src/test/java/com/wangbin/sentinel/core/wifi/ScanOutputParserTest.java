package com.wangbin.sentinel.core.wifi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanOutputParserTest {

    private static final String IWLIST_OUTPUT = String.join("\n",
            "wlan0     Scan completed :",
            "          Cell 01 - Address: 00:11:22:33:44:55",
            "                    Channel:6",
            "                    Frequency:2.437 GHz (Channel 6)",
            "                    Quality=70/70  Signal level=-40 dBm",
            "                    Encryption key:on",
            "                    ESSID:\"HomeNet\"",
            "                    IE: IEEE 802.11i/WPA2 Version 1",
            "          Cell 02 - Address: 66:77:88:99:aa:bb",
            "                    Frequency:5.18 GHz",
            "                    Quality=40/70  Signal level=-70 dBm",
            "                    Encryption key:off",
            "                    ESSID:\"\"");

    private static final String IW_OUTPUT = String.join("\n",
            "BSS 00:11:22:33:44:55(on wlan0)",
            "\tfreq: 2412",
            "\tsignal: -55.00 dBm",
            "\tSSID: CafeWifi",
            "\tcapability: ESS Privacy ShortSlotTime (0x0411)",
            "\tRSN:\t * Version: 1",
            "BSS aa:bb:cc:dd:ee:ff(on wlan0)",
            "\tfreq: 5745",
            "\tsignal: -80.00 dBm",
            "\tSSID: ",
            "\tcapability: ESS (0x0001)");

    private final ScanOutputParser parser = new ScanOutputParser();

    @Test
    void parsesIwlistCells() {
        List<WifiNetworkObservation> networks = parser.parseIwlist(IWLIST_OUTPUT);

        assertEquals(2, networks.size());
        WifiNetworkObservation home = networks.get(0);
        assertEquals("HomeNet", home.getSsid());
        assertEquals("00:11:22:33:44:55", home.getBssid());
        assertEquals(6, home.getChannel());
        assertEquals(2437, home.getFrequency());
        assertEquals(WifiBand.BAND_2G, home.getBand());
        assertEquals(-40, home.getSignalDbm());
        assertEquals("WPA2", home.getSecurity());
        assertFalse(home.isHidden());

        WifiNetworkObservation hidden = networks.get(1);
        assertEquals("66:77:88:99:AA:BB", hidden.getBssid());
        assertEquals(36, hidden.getChannel());
        assertEquals(WifiBand.BAND_5G, hidden.getBand());
        assertEquals("Open", hidden.getSecurity());
        assertTrue(hidden.isHidden());
    }

    @Test
    void parsesIwScanDump() {
        List<WifiNetworkObservation> networks = parser.parseIw(IW_OUTPUT);

        assertEquals(2, networks.size());
        WifiNetworkObservation cafe = networks.get(0);
        assertEquals("CafeWifi", cafe.getSsid());
        assertEquals(1, cafe.getChannel());
        assertEquals(-55, cafe.getSignalDbm());
        assertEquals("WPA2", cafe.getSecurity());

        WifiNetworkObservation open = networks.get(1);
        assertEquals("AA:BB:CC:DD:EE:FF", open.getBssid());
        assertEquals(149, open.getChannel());
        assertEquals(WifiBand.BAND_5G, open.getBand());
        assertEquals("Open", open.getSecurity());
        assertTrue(open.isHidden());
    }

    @Test
    void garbageNeverThrows() {
        assertTrue(parser.parseIwlist("this is not a scan\n\u0000\u0001").isEmpty());
        assertTrue(parser.parseIw("BSS nothing here\nfreq: abc").isEmpty());
        assertTrue(parser.parseIwlist(null).isEmpty());
        assertTrue(parser.parseIw("").isEmpty());
    }

    @Test
    void badFieldIsSkippedAndDefaultsApply() {
        String output = String.join("\n",
                "Cell 01 - Address: 00:11:22:33:44:55",
                "Channel:99999999999",
                "ESSID:\"Partial\"");

        List<WifiNetworkObservation> networks = parser.parseIwlist(output);

        assertEquals(1, networks.size());
        WifiNetworkObservation partial = networks.get(0);
        assertEquals("Partial", partial.getSsid());
        assertEquals(0, partial.getChannel());
        assertEquals(WifiNetworkObservation.MISSING_SIGNAL_DBM, partial.getSignalDbm());
        assertEquals("Unknown", partial.getSecurity());
    }
}
