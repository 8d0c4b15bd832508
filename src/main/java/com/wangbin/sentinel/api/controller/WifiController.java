package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import com.wangbin.sentinel.core.health.WifiStats;
import com.wangbin.sentinel.core.wifi.ChannelReport;
import com.wangbin.sentinel.core.wifi.ChannelStat;
import com.wangbin.sentinel.core.wifi.WifiBand;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 无线统计与信道分析接口
 */
@RestController
@RequestMapping("/api/v2/wifi")
@RequiredArgsConstructor
public class WifiController {

    private final AnalysisOrchestrator orchestrator;

    @GetMapping("/stats")
    public ApiResult<WifiStats> stats() {
        return ApiResult.success(orchestrator.currentResult().getWifiStats());
    }

    @GetMapping("/scan")
    public ApiResult<ChannelReport> scan() {
        return ApiResult.success(orchestrator.channelReport());
    }

    /**
     * 按频段返回信道统计，未指定频段时返回全部
     */
    @GetMapping("/channels")
    public ApiResult<Map<String, List<ChannelStat>>> channels(@RequestParam(required = false) String band) {
        ChannelReport report = orchestrator.channelReport();
        Map<String, List<ChannelStat>> data = new LinkedHashMap<>();
        if (band == null || band.isBlank()) {
            for (WifiBand each : WifiBand.values()) {
                data.put(each.getCode(), report.channelsOf(each));
            }
            return ApiResult.success(data);
        }
        WifiBand wanted = WifiBand.fromCode(band);
        if (wanted == null) {
            throw new BusinessException(ResultCode.PARAM_ERROR, "未知的频段: " + band, (Object) null);
        }
        data.put(wanted.getCode(), report.channelsOf(wanted));
        return ApiResult.success(data);
    }
}
