package com.wangbin.sentinel.core.wifi;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 按频段汇总扫描结果：逐信道评分、给出推荐信道、检测 2.4G 信道重叠。
 */
@Slf4j
public class ChannelAnalyzer {

    static final int OVERLAP_SOURCE_ABOVE = 60;
    static final int OVERLAP_NEIGHBOUR_ABOVE = 40;
    static final int OVERLAP_DISTANCE = 2;
    static final int MAX_OVERLAP_GROUPS = 3;

    private final ChannelCongestionScorer scorer;

    public ChannelAnalyzer(ChannelCongestionScorer scorer) {
        this.scorer = scorer;
    }

    public ChannelReport analyze(Collection<WifiNetworkObservation> observations, Instant now) {
        List<WifiNetworkObservation> networks = observations == null
                ? Collections.emptyList()
                : observations.stream().filter(Objects::nonNull).collect(Collectors.toList());

        Map<WifiBand, List<ChannelStat>> channels = new EnumMap<>(WifiBand.class);
        Map<WifiBand, ChannelRecommendation> bandRecommendations = new EnumMap<>(WifiBand.class);
        for (WifiBand band : WifiBand.values()) {
            List<ChannelStat> stats = scoreBand(band, networks);
            channels.put(band, stats);
            recommend(band, stats).ifPresent(rec -> bandRecommendations.put(band, rec));
        }

        List<ChannelOverlap> overlaps = findOverlaps(channels.get(WifiBand.BAND_2G));
        int hidden = (int) networks.stream().filter(WifiNetworkObservation::isHidden).count();

        List<String> messages = new ArrayList<>();
        for (ChannelRecommendation rec : bandRecommendations.values()) {
            if (rec.getLevel() != CongestionLevel.HEALTHY) {
                messages.add(rec.getMessage());
            }
        }
        if (hidden > 0) {
            messages.add("检测到 " + hidden + " 个隐藏网络");
        }
        if (!overlaps.isEmpty()) {
            messages.add("检测到信道重叠: " + overlaps.stream()
                    .map(ChannelOverlap::describe)
                    .collect(Collectors.joining(", ")));
        }
        if (messages.isEmpty()) {
            messages.add("WiFi 环境良好，无明显问题");
        }

        log.debug("无线环境分析完成: networks={}, hidden={}, overlaps={}", networks.size(), hidden, overlaps.size());
        return ChannelReport.builder()
                .timestamp(now)
                .networks(networks)
                .channels(channels)
                .bandRecommendations(bandRecommendations)
                .overlaps(overlaps)
                .hiddenNetworks(hidden)
                .recommendations(messages)
                .build();
    }

    List<ChannelStat> scoreBand(WifiBand band, List<WifiNetworkObservation> networks) {
        Map<Integer, List<WifiNetworkObservation>> byChannel = new HashMap<>();
        for (WifiNetworkObservation network : networks) {
            if (network.getBand() == band) {
                byChannel.computeIfAbsent(network.getChannel(), k -> new ArrayList<>()).add(network);
            }
        }
        List<ChannelStat> stats = new ArrayList<>();
        for (int channel : ChannelPlan.channels(band)) {
            stats.add(scorer.score(channel, band, byChannel.getOrDefault(channel, Collections.emptyList())));
        }
        return stats;
    }

    Optional<ChannelRecommendation> recommend(WifiBand band, List<ChannelStat> stats) {
        if (stats == null || stats.isEmpty()) {
            return Optional.empty();
        }
        // 拥堵度相同时取列表中靠前的信道
        ChannelStat best = stats.get(0);
        for (ChannelStat stat : stats) {
            if (stat.getUtilizationPercent() < best.getUtilizationPercent()) {
                best = stat;
            }
        }
        CongestionLevel level = CongestionLevel.of(best.getUtilizationPercent());
        return Optional.of(ChannelRecommendation.builder()
                .band(band)
                .level(level)
                .bestChannel(best.getChannel())
                .utilizationPercent(best.getUtilizationPercent())
                .message(message(band, level, best))
                .build());
    }

    List<ChannelOverlap> findOverlaps(List<ChannelStat> stats) {
        if (stats == null || stats.isEmpty()) {
            return Collections.emptyList();
        }
        List<ChannelOverlap> groups = new ArrayList<>();
        for (ChannelStat stat : stats) {
            if (stat.getUtilizationPercent() <= OVERLAP_SOURCE_ABOVE) {
                continue;
            }
            List<Integer> neighbours = stats.stream()
                    .filter(other -> other.getChannel() != stat.getChannel())
                    .filter(other -> Math.abs(other.getChannel() - stat.getChannel()) <= OVERLAP_DISTANCE)
                    .filter(other -> other.getUtilizationPercent() > OVERLAP_NEIGHBOUR_ABOVE)
                    .map(ChannelStat::getChannel)
                    .collect(Collectors.toList());
            if (!neighbours.isEmpty()) {
                groups.add(ChannelOverlap.builder()
                        .channel(stat.getChannel())
                        .utilizationPercent(stat.getUtilizationPercent())
                        .neighbours(neighbours)
                        .build());
            }
        }
        return groups.stream()
                .sorted(Comparator.comparingInt(ChannelOverlap::getUtilizationPercent).reversed())
                .limit(MAX_OVERLAP_GROUPS)
                .collect(Collectors.toList());
    }

    private String message(WifiBand band, CongestionLevel level, ChannelStat best) {
        String bandName = band.getCode();
        return switch (level) {
            case CONGESTED -> band == WifiBand.BAND_2G
                    ? "2.4G 频段拥堵严重，建议使用 5G 频段"
                    : bandName + " 频段也较拥堵，推荐信道: " + best.getChannel();
            case BUSY -> bandName + " 推荐信道: " + best.getChannel()
                    + "（拥堵度 " + best.getUtilizationPercent() + "%）";
            case HEALTHY -> bandName + " 信道状况良好，推荐信道: " + best.getChannel();
        };
    }
}
