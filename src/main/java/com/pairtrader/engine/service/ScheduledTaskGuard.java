package com.pairtrader.engine.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one iteration of a background task so that a failure is logged and counted
 * instead of ending the loop that called it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    /**
     * @return false when the task threw
     */
    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            metricsService.recordTaskFailure(taskName);
            return false;
        }
    }
}
