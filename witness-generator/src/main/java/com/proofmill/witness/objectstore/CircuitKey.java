package com.proofmill.witness.objectstore;

import com.proofmill.witness.model.AggregationRound;

/**
 * Location of a circuit produced by a witness job.
 *
 * Object name: {@code {batch}_{sequence}_{circuit}_{ROUND}_{depth}.bin}.
 * The format is read by the prover, so keep it stable.
 */
public record CircuitKey(
        long             l1BatchNumber,
        int              circuitId,
        long             sequenceNumber,
        int              depth,
        AggregationRound round
) implements BlobKey {

    public CircuitKey {
        if (round == null) throw new IllegalArgumentException("round is required");
    }

    @Override
    public Bucket bucket() { return Bucket.PROVER_JOBS; }

    @Override
    public String objectName() {
        return l1BatchNumber + "_" + sequenceNumber + "_" + circuitId + "_" + round.name() + "_" + depth + ".bin";
    }
}
