package com.proofmill.witness.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One witness-generation job: "build the circuit of round R for batch B".
 *
 * The row is created by the upstream stage in QUEUED state. The engine
 * claims it with a compare-and-set update (QUEUED → PICKED), so two engine
 * instances can never work on the same (batch, round) at the same time.
 * Every later write by the engine is fenced on {@code pickedBy}: once the job
 * has been requeued and claimed by someone else, the old owner's writes are
 * rejected.
 *
 * DB table: witness_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "witness_jobs",
       uniqueConstraints = @UniqueConstraint(columnNames = {"l1_batch_number", "aggregation_round"}))
public class WitnessJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "l1_batch_number", nullable = false)
    private long l1BatchNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregation_round", nullable = false)
    private AggregationRound round;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WitnessJobStatus status = WitnessJobStatus.QUEUED;

    // Incremented on every claim, so it counts attempts rather than failures.
    @Column(nullable = false)
    private int attempts = 0;

    // Identifies which engine instance claimed the job.
    @Column(name = "picked_by")
    private String pickedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private FailureKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "processing_started_at")
    private Instant processingStartedAt;

    // Refreshed by the owning worker while the job is in flight.
    // The requeue policy resets jobs whose heartbeat is too old.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "time_taken_ms")
    private Long timeTakenMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WitnessJob() {}   // required by JPA

    public WitnessJob(long l1BatchNumber, AggregationRound round) {
        this.l1BatchNumber = l1BatchNumber;
        this.round         = round;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long             getId()                  { return id; }
    public long             getL1BatchNumber()       { return l1BatchNumber; }
    public AggregationRound getRound()               { return round; }
    public WitnessJobStatus getStatus()              { return status; }
    public int              getAttempts()            { return attempts; }
    public String           getPickedBy()            { return pickedBy; }
    public FailureKind      getErrorKind()           { return errorKind; }
    public String           getErrorMessage()        { return errorMessage; }
    public Instant          getProcessingStartedAt() { return processingStartedAt; }
    public Instant          getHeartbeatAt()         { return heartbeatAt; }
    public Long             getTimeTakenMs()         { return timeTakenMs; }
    public Instant          getCreatedAt()           { return createdAt; }
    public Instant          getUpdatedAt()           { return updatedAt; }

    public void setStatus(WitnessJobStatus status)     { this.status = status; }
    public void setPickedBy(String pickedBy)           { this.pickedBy = pickedBy; }
    public void setErrorKind(FailureKind errorKind)    { this.errorKind = errorKind; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setProcessingStartedAt(Instant t)      { this.processingStartedAt = t; }
    public void setTimeTakenMs(Long timeTakenMs)       { this.timeTakenMs = timeTakenMs; }
}
