package com.proofmill.witness.processor;

import com.proofmill.witness.circuit.ProofArtifact;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.objectstore.BlobKey;
import com.proofmill.witness.service.ProverJobInsert;

import java.util.List;

/**
 * What one aggregation round contributes to the generic job processor.
 *
 * A stage never touches the ledger: it turns inputs into values and the
 * {@link WitnessJobProcessor} owns every status transition.
 *
 * @param <J> the assembled job handed to compute
 * @param <A> the artifact compute produces; stored in the object store as-is
 */
public interface WitnessStage<J, A> {

    /** Round whose jobs this stage processes. */
    AggregationRound round();

    /** Stable name used for worker ids and logs. */
    String serviceName();

    /** Number of upstream proofs a job of this round consumes. */
    int expectedDependencyCount();

    /**
     * Assemble the job from the fetched upstream proofs (in slot order) and
     * whatever else the stage loads for the batch.
     *
     * @throws WitnessGenerationException with INPUT_CONTRACT_VIOLATION for structurally wrong inputs
     */
    J prepare(long l1BatchNumber, List<ProofArtifact> dependencyProofs);

    /** CPU-bound build. Runs on a worker thread and does no I/O. */
    A compute(J job);

    /** Where the artifact of a batch is stored. Must depend on the batch number only. */
    BlobKey artifactKey(long l1BatchNumber);

    /** The next-stage prover job that the stored artifact unblocks. */
    ProverJobInsert onSuccess(long l1BatchNumber, String artifactBlobUrl);

    /** Called after the failure has been recorded in the ledger. */
    default void onFailure(long l1BatchNumber, WitnessGenerationException failure) {}
}
