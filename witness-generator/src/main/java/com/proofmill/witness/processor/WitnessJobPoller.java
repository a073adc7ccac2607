package com.proofmill.witness.processor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The polling loop of this process.
 *
 * Every tick tries to start one job. Compute runs on the processor's worker
 * pool, so a tick returns as soon as the job is dispatched and the loop keeps
 * its cadence while workers are busy. When all workers are busy or nothing
 * is ready, the tick is a no-op and the next one comes after the fixed delay.
 *
 * A second schedule heartbeats the jobs in flight so the requeue policy
 * leaves them alone however long compute takes.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "witness.poller.enabled", havingValue = "true", matchIfMissing = true)
public class WitnessJobPoller {

    private final WitnessJobProcessor<?, ?> processor;

    public WitnessJobPoller(WitnessJobProcessor<?, ?> processor) {
        this.processor = processor;
    }

    @Scheduled(fixedDelayString = "${witness.poller.interval-ms:1000}")
    public void tick() {
        processor.pollOnce();
    }

    @Scheduled(fixedDelayString = "${witness.poller.heartbeat-interval-ms:30000}")
    public void heartbeat() {
        processor.heartbeatInFlight();
    }
}
