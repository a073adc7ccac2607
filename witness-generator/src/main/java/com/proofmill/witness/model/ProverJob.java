package com.proofmill.witness.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A proving job for one circuit.
 *
 * Witness jobs read these rows in two ways: upstream prover jobs are the
 * dependencies whose proofs a witness job consumes, and each successful
 * witness job inserts the prover job for the circuit it just built.
 *
 * DB table: prover_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "prover_jobs",
       uniqueConstraints = @UniqueConstraint(columnNames = {
               "l1_batch_number", "aggregation_round", "circuit_id", "depth", "sequence_number"}))
public class ProverJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "l1_batch_number", nullable = false)
    private long l1BatchNumber;

    @Column(name = "circuit_id", nullable = false)
    private int circuitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregation_round", nullable = false)
    private AggregationRound round;

    @Column(name = "sequence_number", nullable = false)
    private long sequenceNumber;

    @Column(nullable = false)
    private int depth;

    @Column(name = "circuit_blob_url", nullable = false)
    private String circuitBlobUrl;

    @Column(name = "is_node_final_proof", nullable = false)
    private boolean nodeFinalProof;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProverJobStatus status = ProverJobStatus.QUEUED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected ProverJob() {}   // required by JPA

    public ProverJob(long l1BatchNumber, int circuitId, AggregationRound round,
                     long sequenceNumber, int depth, String circuitBlobUrl, boolean nodeFinalProof) {
        this.l1BatchNumber  = l1BatchNumber;
        this.circuitId      = circuitId;
        this.round          = round;
        this.sequenceNumber = sequenceNumber;
        this.depth          = depth;
        this.circuitBlobUrl = circuitBlobUrl;
        this.nodeFinalProof = nodeFinalProof;
    }

    public Long             getId()             { return id; }
    public long             getL1BatchNumber()  { return l1BatchNumber; }
    public int              getCircuitId()      { return circuitId; }
    public AggregationRound getRound()          { return round; }
    public long             getSequenceNumber() { return sequenceNumber; }
    public int              getDepth()          { return depth; }
    public String           getCircuitBlobUrl() { return circuitBlobUrl; }
    public boolean          isNodeFinalProof()  { return nodeFinalProof; }
    public ProverJobStatus  getStatus()         { return status; }
    public Instant          getCreatedAt()      { return createdAt; }
    public Instant          getUpdatedAt()      { return updatedAt; }

    public void setStatus(ProverJobStatus status)        { this.status = status; }
    public void setCircuitBlobUrl(String circuitBlobUrl) { this.circuitBlobUrl = circuitBlobUrl; }
}
