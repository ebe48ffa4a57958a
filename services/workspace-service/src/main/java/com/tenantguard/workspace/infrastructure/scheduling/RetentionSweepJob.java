package com.tenantguard.workspace.infrastructure.scheduling;

import com.tenantguard.quota.RetentionSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link RetentionSweeper} on a fixed delay of {@code tenantguard.quota.sweep-interval}.
 */
@Component
public class RetentionSweepJob {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweepJob.class);

    private final RetentionSweeper sweeper;

    public RetentionSweepJob(RetentionSweeper sweeper) {
        this.sweeper = sweeper;
    }

    @Scheduled(
            fixedDelayString = "${tenantguard.quota.sweep-interval:PT10M}",
            initialDelayString = "${tenantguard.quota.sweep-interval:PT10M}")
    public void sweep() {
        log.debug("Starting retention sweep");
        sweeper.sweep();
    }
}
