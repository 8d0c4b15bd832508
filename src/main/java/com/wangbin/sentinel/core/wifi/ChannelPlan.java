package com.wangbin.sentinel.core.wifi;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 各频段的可用信道及信道/频率换算。
 */
public final class ChannelPlan {

    private static final List<Integer> CHANNELS_2G = IntStream.rangeClosed(1, 13)
            .boxed()
            .collect(Collectors.toUnmodifiableList());

    private static final List<Integer> CHANNELS_5G = List.of(
            36, 40, 44, 48, 52, 56, 60, 64,
            100, 104, 108, 112, 116, 120, 124, 128, 132, 136, 140, 144,
            149, 153, 157, 161, 165);

    private ChannelPlan() {
    }

    /**
     * 6G 暂不做信道分析，返回空列表
     */
    public static List<Integer> channels(WifiBand band) {
        if (band == null) {
            return List.of();
        }
        return switch (band) {
            case BAND_2G -> CHANNELS_2G;
            case BAND_5G -> CHANNELS_5G;
            case BAND_6G -> List.of();
        };
    }

    public static int frequencyOf(WifiBand band, int channel) {
        if (band == WifiBand.BAND_2G) {
            return channel == 14 ? 2484 : 2407 + channel * 5;
        }
        return band.getBaseFrequency() + channel * 5;
    }

    public static int channelOf(int frequencyMhz) {
        if (frequencyMhz == 2484) {
            return 14;
        }
        if (frequencyMhz >= 2412 && frequencyMhz <= 2472) {
            return (frequencyMhz - 2407) / 5;
        }
        if (frequencyMhz > 5000 && frequencyMhz < 5925) {
            return (frequencyMhz - 5000) / 5;
        }
        if (frequencyMhz == 5935) {
            return 2;
        }
        if (frequencyMhz >= 5950) {
            return (frequencyMhz - 5950) / 5;
        }
        return 0;
    }
}
