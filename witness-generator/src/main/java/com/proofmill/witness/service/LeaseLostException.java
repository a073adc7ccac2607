package com.proofmill.witness.service;

import com.proofmill.witness.model.AggregationRound;

/**
 * A worker tried to change a witness job it no longer owns.
 *
 * Happens when the job was requeued after its heartbeat went stale, and was
 * then claimed by another worker or already finished. The write is rejected
 * and, for {@code completeJob}, the whole transaction rolls back.
 */
public class LeaseLostException extends RuntimeException {

    private final long             l1BatchNumber;
    private final AggregationRound round;
    private final String           workerId;

    public LeaseLostException(long l1BatchNumber, AggregationRound round, String workerId) {
        super(round + " witness job for batch " + l1BatchNumber + " is no longer owned by '" + workerId + "'");
        this.l1BatchNumber = l1BatchNumber;
        this.round         = round;
        this.workerId      = workerId;
    }

    public long             getL1BatchNumber() { return l1BatchNumber; }
    public AggregationRound getRound()         { return round; }
    public String           getWorkerId()      { return workerId; }
}
