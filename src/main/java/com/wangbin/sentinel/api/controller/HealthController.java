package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.core.analysis.AnalysisOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 存活检查接口。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AnalysisOrchestrator orchestrator;

    @GetMapping("/healthz")
    public Map<String, Object> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "ok");
        result.put("completedCycles", orchestrator.getCompletedCycles());
        result.put("historySize", orchestrator.getHistory().size());
        result.put("timestamp", System.currentTimeMillis());
        return result;
    }
}
