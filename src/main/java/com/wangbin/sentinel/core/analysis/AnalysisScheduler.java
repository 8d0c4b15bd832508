package com.wangbin.sentinel.core.analysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时分析，间隔取 sentinel.analysis.interval。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sentinel.analysis", name = "schedule-enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisScheduler {

    private final AnalysisOrchestrator orchestrator;

    @Scheduled(initialDelay = 5_000,
            fixedDelayString = "#{@sentinelProperties.analysis.intervalMillis}")
    public void schedule() {
        try {
            orchestrator.runCycle();
        } catch (CycleInterruptedException e) {
            log.warn("定时分析被中断: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("定时分析失败", e);
        }
    }
}
