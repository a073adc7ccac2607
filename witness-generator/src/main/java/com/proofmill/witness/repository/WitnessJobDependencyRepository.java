package com.proofmill.witness.repository;

import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.WitnessJobDependency;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * CRUD for the witness_job_dependencies table.
 */
public interface WitnessJobDependencyRepository extends JpaRepository<WitnessJobDependency, Long> {

    /** Dependency slots of a job in slot order. */
    List<WitnessJobDependency> findByL1BatchNumberAndRoundOrderByCircuitIdAsc(long l1BatchNumber,
                                                                            AggregationRound round);

    Optional<WitnessJobDependency> findByL1BatchNumberAndRoundAndCircuitId(long l1BatchNumber,
                                                                          AggregationRound round,
                                                                          int circuitId);
}
