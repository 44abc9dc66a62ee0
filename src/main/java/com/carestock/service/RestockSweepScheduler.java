package com.carestock.service;

import com.carestock.dto.SweepResultResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "restock.sweep.scheduled.enabled", havingValue = "true")
public class RestockSweepScheduler {

    private final RestockSweepService sweepService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${restock.sweep.cron:0 0 6 * * *}")
    public void runScheduledSweep() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scheduled restock sweep skipped | reason=previous run still in progress");
            return;
        }
        try {
            SweepResultResponse result = sweepService.commit();
            log.info("Scheduled restock sweep done | evaluated={} | created={}",
                     result.getEvaluatedCount(), result.getCreated().size());
        } catch (RuntimeException ex) {
            log.error("Scheduled restock sweep failed: {}", ex.getMessage(), ex);
        } finally {
            running.set(false);
        }
    }
}
