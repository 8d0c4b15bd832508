package com.wangbin.sentinel.core.wifi;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 无线频段
 */
@Getter
public enum WifiBand {

    BAND_2G("2.4G", 2400),
    BAND_5G("5G", 5000),
    BAND_6G("6G", 5950);

    private final String code;
    /**
     * 信道号换算频率的基准（MHz）
     */
    private final int baseFrequency;

    WifiBand(String code, int baseFrequency) {
        this.code = code;
        this.baseFrequency = baseFrequency;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WifiBand fromFrequency(int frequencyMhz) {
        if (frequencyMhz < 3000) {
            return BAND_2G;
        }
        if (frequencyMhz < 5925) {
            return BAND_5G;
        }
        return BAND_6G;
    }

    // 支持 "2.4G" / "2g" / "5G" / "5ghz" 等写法
    public static WifiBand fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toUpperCase().replace("GHZ", "G");
        return switch (normalized) {
            case "2.4G", "2G", "2.4", "BAND_2G" -> BAND_2G;
            case "5G", "5", "BAND_5G" -> BAND_5G;
            case "6G", "6", "BAND_6G" -> BAND_6G;
            default -> null;
        };
    }
}
