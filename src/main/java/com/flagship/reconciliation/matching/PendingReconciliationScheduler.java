package com.flagship.reconciliation.matching;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the pending sweep periodically. Off unless reconciliation.sweep.enabled=true.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "reconciliation.sweep.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PendingReconciliationScheduler {

    private final PendingReconciliationSweeper sweeper;

    @Scheduled(fixedDelayString = "${reconciliation.sweep.interval-ms:60000}",
               initialDelayString = "${reconciliation.sweep.initial-delay-ms:30000}")
    public void sweepPending() {
        try {
            sweeper.sweep();
        } catch (Exception e) {
            // Next run retries
            log.error("Scheduled pending sweep failed", e);
        }
    }
}
