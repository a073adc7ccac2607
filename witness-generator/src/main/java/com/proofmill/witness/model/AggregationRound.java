package com.proofmill.witness.model;

/**
 * The rounds of the proof-aggregation pipeline, in pipeline order.
 *
 * Each round consumes only artifacts produced by the round before it:
 *   BASIC_CIRCUITS → LEAF_AGGREGATION → NODE_AGGREGATION → SCHEDULER
 *
 * The names are persisted (ledger rows and blob names), so they must not change.
 */
public enum AggregationRound {
    BASIC_CIRCUITS,
    LEAF_AGGREGATION,
    NODE_AGGREGATION,
    SCHEDULER;

    /** The round whose artifacts this round consumes, or null for BASIC_CIRCUITS. */
    public AggregationRound previous() {
        int idx = ordinal();
        return idx == 0 ? null : values()[idx - 1];
    }
}
