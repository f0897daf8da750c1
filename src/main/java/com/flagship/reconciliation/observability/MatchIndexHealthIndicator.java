package com.flagship.reconciliation.observability;

import com.flagship.reconciliation.matching.MatchIndex;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the in-memory match index.
 *
 * A very large pending set means counterparts are not arriving (a provider feed is down)
 * or matching rules are rejecting most records.
 */
@Component("matchIndexHealth")
public class MatchIndexHealthIndicator implements HealthIndicator {

    private static final long BACKLOG_WARNING_THRESHOLD = 10_000;
    private static final long BACKLOG_CRITICAL_THRESHOLD = 100_000;

    private final MatchIndex matchIndex;

    public MatchIndexHealthIndicator(MatchIndex matchIndex) {
        this.matchIndex = matchIndex;
    }

    @Override
    public Health health() {
        long pending = matchIndex.size();

        Health.Builder builder = pending < BACKLOG_WARNING_THRESHOLD
                ? Health.up()
                : pending < BACKLOG_CRITICAL_THRESHOLD
                ? Health.status("WARNING")
                : Health.down();

        return builder
                .withDetail("pendingIndexed", pending)
                .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                .build();
    }
}
