package com.wangbin.sentinel.core.wifi;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 {@code iwlist <if> scan} 与 {@code iw <if> scan dump} 的文本输出。
 * <p>
 * 单个字段解析失败只跳过该字段，没有 BSSID 的条目被丢弃，任何输入都不会抛异常。
 */
@Slf4j
public class ScanOutputParser {

    // iwlist
    private static final Pattern IWLIST_CELL = Pattern.compile("Cell\\s+\\d+\\s+-\\s+Address:\\s*([0-9A-Fa-f:]{17})");
    private static final Pattern IWLIST_ESSID = Pattern.compile("ESSID:\"(.*)\"");
    private static final Pattern IWLIST_SIGNAL = Pattern.compile("Signal level[=:]\\s*(-?\\d+(?:\\.\\d+)?)\\s*dBm");
    private static final Pattern IWLIST_CHANNEL = Pattern.compile("^Channel[:\\s]\\s*(\\d+)");
    private static final Pattern IWLIST_FREQUENCY = Pattern.compile("Frequency[:=]\\s*(\\d+(?:\\.\\d+)?)\\s*GHz");

    // iw
    private static final Pattern IW_BSS = Pattern.compile("^BSS\\s+([0-9A-Fa-f:]{17})");
    private static final Pattern IW_SSID = Pattern.compile("^SSID:\\s?(.*)$");
    private static final Pattern IW_SIGNAL = Pattern.compile("^signal:\\s*(-?\\d+(?:\\.\\d+)?)\\s*dBm");
    private static final Pattern IW_FREQ = Pattern.compile("^freq:\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern IW_CHANNEL = Pattern.compile("(?:DS Parameter set: channel|primary channel:)\\s*(\\d+)");

    public List<WifiNetworkObservation> parseIwlist(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        List<WifiNetworkObservation> networks = new ArrayList<>();
        Cell current = null;

        for (String rawLine : output.split("\\R")) {
            String line = rawLine.trim();
            try {
                Matcher cell = IWLIST_CELL.matcher(line);
                if (cell.find()) {
                    addIfComplete(networks, current);
                    current = new Cell(cell.group(1));
                    continue;
                }
                if (current == null) {
                    continue;
                }
                Matcher essid = IWLIST_ESSID.matcher(line);
                if (essid.find()) {
                    current.ssid = essid.group(1);
                    continue;
                }
                Matcher signal = IWLIST_SIGNAL.matcher(line);
                if (signal.find()) {
                    current.signalDbm = (int) Math.round(Double.parseDouble(signal.group(1)));
                    continue;
                }
                Matcher frequency = IWLIST_FREQUENCY.matcher(line);
                if (frequency.find()) {
                    current.frequency = (int) Math.round(Double.parseDouble(frequency.group(1)) * 1000);
                    continue;
                }
                Matcher channel = IWLIST_CHANNEL.matcher(line);
                if (channel.find()) {
                    current.channel = Integer.parseInt(channel.group(1));
                    continue;
                }
                if (line.contains("Encryption key:off")) {
                    current.security = "Open";
                } else if (line.contains("WPA3") || line.contains("SAE")) {
                    current.security = "WPA3";
                } else if (line.contains("WPA2") && !"WPA3".equals(current.security)) {
                    current.security = "WPA2";
                } else if (line.contains("WPA Version") && current.security == null) {
                    current.security = "WPA";
                } else if (line.contains("WEP") && current.security == null) {
                    current.security = "WEP";
                }
            } catch (RuntimeException e) {
                log.debug("跳过无法解析的 iwlist 行: {}", line);
            }
        }
        addIfComplete(networks, current);
        return networks;
    }

    public List<WifiNetworkObservation> parseIw(String output) {
        if (output == null || output.isBlank()) {
            return Collections.emptyList();
        }
        List<WifiNetworkObservation> networks = new ArrayList<>();
        Cell current = null;

        for (String rawLine : output.split("\\R")) {
            String line = rawLine.trim();
            try {
                Matcher bss = IW_BSS.matcher(line);
                if (bss.find()) {
                    addIfComplete(networks, current);
                    current = new Cell(bss.group(1));
                    continue;
                }
                if (current == null) {
                    continue;
                }
                Matcher ssid = IW_SSID.matcher(line);
                if (ssid.find()) {
                    current.ssid = ssid.group(1).trim();
                    continue;
                }
                Matcher signal = IW_SIGNAL.matcher(line);
                if (signal.find()) {
                    current.signalDbm = (int) Math.round(Double.parseDouble(signal.group(1)));
                    continue;
                }
                Matcher freq = IW_FREQ.matcher(line);
                if (freq.find()) {
                    current.frequency = (int) Math.round(Double.parseDouble(freq.group(1)));
                    continue;
                }
                Matcher channel = IW_CHANNEL.matcher(line);
                if (channel.find()) {
                    current.channel = Integer.parseInt(channel.group(1));
                    continue;
                }
                if (line.contains("SAE")) {
                    current.security = "WPA3";
                } else if (line.startsWith("RSN:") && !"WPA3".equals(current.security)) {
                    current.security = "WPA2";
                } else if (line.startsWith("WPA:") && current.security == null) {
                    current.security = "WPA";
                } else if (line.startsWith("capability:")) {
                    current.privacy = line.contains("Privacy");
                }
            } catch (RuntimeException e) {
                log.debug("跳过无法解析的 iw 行: {}", line);
            }
        }
        addIfComplete(networks, current);
        return networks;
    }

    private void addIfComplete(List<WifiNetworkObservation> networks, Cell cell) {
        if (cell != null && cell.bssid != null && !cell.bssid.isBlank()) {
            networks.add(cell.toObservation());
        }
    }

    /**
     * 解析过程中的可变累积器
     */
    private static final class Cell {
        private final String bssid;
        private String ssid;
        private Integer signalDbm;
        private int channel;
        private int frequency;
        private String security;
        private Boolean privacy;

        private Cell(String bssid) {
            this.bssid = bssid.toUpperCase(Locale.ROOT);
        }

        private WifiNetworkObservation toObservation() {
            int resolvedChannel = channel;
            int resolvedFrequency = frequency;
            WifiBand band;
            if (resolvedFrequency > 0) {
                band = WifiBand.fromFrequency(resolvedFrequency);
                if (resolvedChannel <= 0) {
                    resolvedChannel = ChannelPlan.channelOf(resolvedFrequency);
                }
            } else if (resolvedChannel > 0) {
                band = resolvedChannel <= 14 ? WifiBand.BAND_2G : WifiBand.BAND_5G;
                resolvedFrequency = ChannelPlan.frequencyOf(band, resolvedChannel);
            } else {
                band = WifiBand.BAND_2G;
            }

            String resolvedSecurity = security;
            if (resolvedSecurity == null && privacy != null) {
                resolvedSecurity = privacy ? "WEP" : "Open";
            }

            String name = ssid == null ? "" : ssid;
            boolean hidden = name.isEmpty() || name.chars().allMatch(c -> c == 0) || name.startsWith("\\x00");
            return WifiNetworkObservation.builder()
                    .bssid(bssid)
                    .ssid(hidden ? "" : name)
                    .signalDbm(signalDbm != null ? signalDbm : WifiNetworkObservation.MISSING_SIGNAL_DBM)
                    .channel(resolvedChannel)
                    .frequency(resolvedFrequency)
                    .band(band)
                    .security(resolvedSecurity != null ? resolvedSecurity : "Unknown")
                    .hidden(hidden)
                    .build();
        }
    }
}
