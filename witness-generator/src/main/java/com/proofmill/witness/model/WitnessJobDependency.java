package com.proofmill.witness.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One dependency slot of a witness job: "round R of batch B needs the
 * proof of prover job P for circuit C".
 *
 * The upstream stage records one row per circuit id. The slot order
 * (ascending circuit id) is the order in which the proofs are handed to
 * the compute step, so it is significant.
 *
 * DB table: witness_job_dependencies  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "witness_job_dependencies",
       uniqueConstraints = @UniqueConstraint(
               columnNames = {"l1_batch_number", "aggregation_round", "circuit_id"}))
public class WitnessJobDependency {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "l1_batch_number", nullable = false)
    private long l1BatchNumber;

    // The downstream round that consumes the proof.
    @Enumerated(EnumType.STRING)
    @Column(name = "aggregation_round", nullable = false)
    private AggregationRound round;

    @Column(name = "circuit_id", nullable = false)
    private int circuitId;

    // Null until the upstream prover job for this slot exists.
    @Column(name = "prover_job_id")
    private Long proverJobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected WitnessJobDependency() {}   // required by JPA

    public WitnessJobDependency(long l1BatchNumber, AggregationRound round, int circuitId, Long proverJobId) {
        this.l1BatchNumber = l1BatchNumber;
        this.round         = round;
        this.circuitId     = circuitId;
        this.proverJobId   = proverJobId;
    }

    public Long             getId()            { return id; }
    public long             getL1BatchNumber() { return l1BatchNumber; }
    public AggregationRound getRound()         { return round; }
    public int              getCircuitId()     { return circuitId; }
    public Long             getProverJobId()   { return proverJobId; }
    public Instant          getCreatedAt()     { return createdAt; }

    public void setProverJobId(Long proverJobId) { this.proverJobId = proverJobId; }
}
