package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import com.wangbin.sentinel.core.analysis.AnalysisResult;
import com.wangbin.sentinel.core.device.DeviceDetails;
import com.wangbin.sentinel.core.health.BandwidthSample;
import com.wangbin.sentinel.core.health.HealthSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康指标接口
 */
@Slf4j
@RestController
@RequestMapping("/api/v2")
@RequiredArgsConstructor
public class MetricsController {

    private final AnalysisOrchestrator orchestrator;

    /**
     * 执行一次分析并返回摘要
     */
    @GetMapping("/metrics/summary")
    public ApiResult<HealthSummary> summary() {
        return ApiResult.success(orchestrator.runCycle().getSummary());
    }

    @GetMapping("/metrics/full")
    public ApiResult<AnalysisResult> full() {
        return ApiResult.success(orchestrator.runCycle());
    }

    @GetMapping("/metrics/device/{ip}")
    public ApiResult<DeviceDetails> device(@PathVariable String ip) {
        if (orchestrator.latestRoster().isEmpty()) {
            orchestrator.refreshRoster();
        }
        return orchestrator.deviceDetails(ip)
                .map(ApiResult::success)
                .orElseThrow(() -> new BusinessException(ResultCode.NOT_FOUND, "设备不存在: " + ip, (Object) null));
    }

    @GetMapping("/bandwidth")
    public ApiResult<BandwidthSample> bandwidth() {
        return ApiResult.success(orchestrator.currentResult().getBandwidth());
    }
}
