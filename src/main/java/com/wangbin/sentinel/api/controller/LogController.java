package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.log.LogBuffer;
import com.wangbin.sentinel.core.log.LogEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 路由器日志接口
 */
@RestController
@RequestMapping("/api/v2/logs")
@RequiredArgsConstructor
public class LogController {

    private static final int MAX_LIMIT = 1000;

    private final LogBuffer logBuffer;

    @GetMapping("/recent")
    public ApiResult<Map<String, Object>> recent(@RequestParam(defaultValue = "100") int limit,
                                                 @RequestParam(required = false) String level) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ResultCode.PARAM_ERROR, "limit 取值范围 1-" + MAX_LIMIT + ": " + limit, (Object) null);
        }
        List<LogEntry> logs = logBuffer.recent(limit, level);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", logs.size());
        data.put("logs", logs);
        return ApiResult.success(data);
    }
}
