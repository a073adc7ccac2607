package com.proofmill.witness.repository;

import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.ProverJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * CRUD for the prover_jobs table.
 */
public interface ProverJobRepository extends JpaRepository<ProverJob, Long> {

    /** Natural-key lookup; used to make the downstream insert idempotent. */
    Optional<ProverJob> findByL1BatchNumberAndRoundAndCircuitIdAndDepthAndSequenceNumber(
            long l1BatchNumber, AggregationRound round, int circuitId, int depth, long sequenceNumber);

    List<ProverJob> findByL1BatchNumberAndRound(long l1BatchNumber, AggregationRound round);
}
