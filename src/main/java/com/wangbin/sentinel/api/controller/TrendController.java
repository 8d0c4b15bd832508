package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import com.wangbin.sentinel.core.history.TrendReport;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 历史趋势与分析结果接口
 */
@RestController
@RequestMapping("/api/v2")
@RequiredArgsConstructor
public class TrendController {

    static final int MIN_HOURS = 1;
    static final int MAX_HOURS = 168;

    private final AnalysisOrchestrator orchestrator;

    @GetMapping("/trends")
    public ApiResult<TrendReport> trends(@RequestParam(defaultValue = "24") int hours) {
        if (hours < MIN_HOURS || hours > MAX_HOURS) {
            throw new BusinessException(ResultCode.PARAM_ERROR,
                    "hours 取值范围 " + MIN_HOURS + "-" + MAX_HOURS + ": " + hours, (Object) null);
        }
        return ApiResult.success(orchestrator.trends(hours));
    }

    /**
     * 最近一次分析结果与 24 小时趋势，没有结果时先执行一次分析
     */
    @GetMapping("/analysis")
    public ApiResult<Map<String, Object>> analysis() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("latest", orchestrator.currentResult());
        data.put("trends", orchestrator.trends(24));
        data.put("historySize", orchestrator.getHistory().size());
        return ApiResult.success(data);
    }
}
