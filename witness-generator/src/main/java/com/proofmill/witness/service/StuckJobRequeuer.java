package com.proofmill.witness.service;

import com.proofmill.witness.model.AggregationRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry policy of the ledger: periodically puts stalled and transiently
 * failed jobs of this process's round back in the queue.
 *
 * Runs every 60 seconds. Only one instance needs to run it, but running it
 * on several is harmless: the update is a single idempotent statement.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "witness.requeue.enabled", havingValue = "true", matchIfMissing = true)
public class StuckJobRequeuer {

    private static final Logger log = LoggerFactory.getLogger(StuckJobRequeuer.class);

    private final WitnessJobQueue  queue;
    private final AggregationRound round;
    private final Duration         stallTimeout;
    private final int              maxAttempts;

    public StuckJobRequeuer(WitnessJobQueue queue,
                            @Value("${witness.round}") AggregationRound round,
                            @Value("${witness.requeue.stall-timeout}") Duration stallTimeout,
                            @Value("${witness.requeue.max-attempts}") int maxAttempts) {
        this.queue        = queue;
        this.round        = round;
        this.stallTimeout = stallTimeout;
        this.maxAttempts  = maxAttempts;
    }

    @Scheduled(fixedDelayString = "${witness.requeue.interval-ms:60000}")
    public void requeue() {
        try {
            queue.requeueStuckJobs(round, stallTimeout, maxAttempts);
        } catch (Exception e) {
            log.error("Requeue of stuck {} witness jobs failed: {}", round, e.getMessage(), e);
        }
    }
}
