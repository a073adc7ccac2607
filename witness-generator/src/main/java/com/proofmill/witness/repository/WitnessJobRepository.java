package com.proofmill.witness.repository;

import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.FailureKind;
import com.proofmill.witness.model.ProverJobStatus;
import com.proofmill.witness.model.WitnessJob;
import com.proofmill.witness.model.WitnessJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + claim queries for the witness_jobs table.
 */
public interface WitnessJobRepository extends JpaRepository<WitnessJob, Long> {

    Optional<WitnessJob> findByL1BatchNumberAndRound(long l1BatchNumber, AggregationRound round);

    /**
     * Batch numbers of QUEUED jobs whose dependencies are all in place, oldest batch first.
     *
     * A job is ready when exactly {@code expected} of its dependency slots point
     * at a prover job in state {@code successful}. Slots without a prover job,
     * or pointing at an unfinished one, do not count.
     */
    @Query("""
            SELECT w.l1BatchNumber FROM WitnessJob w
            WHERE w.round = :round
              AND w.status = :queued
              AND (SELECT COUNT(d) FROM WitnessJobDependency d, ProverJob p
                   WHERE p.id = d.proverJobId
                     AND d.l1BatchNumber = w.l1BatchNumber
                     AND d.round = w.round
                     AND p.status = :successful) = :expected
            ORDER BY w.l1BatchNumber ASC
            """)
    List<Long> findReadyBatchNumbers(@Param("round") AggregationRound round,
                                     @Param("queued") WitnessJobStatus queued,
                                     @Param("successful") ProverJobStatus successful,
                                     @Param("expected") long expected,
                                     Pageable page);

    /**
     * Compare-and-set claim: QUEUED → PICKED.
     *
     * Returns 1 if this caller won the job, 0 if another instance claimed it
     * first. The WHERE clause is re-checked after the row lock is acquired, so
     * two concurrent callers can never both see 1 for the same row.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.status = :picked,
                w.pickedBy = :pickedBy,
                w.attempts = w.attempts + 1,
                w.processingStartedAt = :now,
                w.heartbeatAt = :now,
                w.updatedAt = :now
            WHERE w.l1BatchNumber = :batch
              AND w.round = :round
              AND w.status = :queued
            """)
    int markPicked(@Param("batch") long l1BatchNumber,
                   @Param("round") AggregationRound round,
                   @Param("pickedBy") String pickedBy,
                   @Param("now") Instant now,
                   @Param("queued") WitnessJobStatus queued,
                   @Param("picked") WitnessJobStatus picked);

    // ------------------------------------------------------------------
    // Owner-fenced writes. Each returns 0 when the caller no longer owns an
    // in-flight job: it was requeued, claimed by another worker, or finished.
    // ------------------------------------------------------------------

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.status = :processing,
                w.heartbeatAt = :now,
                w.updatedAt = :now
            WHERE w.l1BatchNumber = :batch
              AND w.round = :round
              AND w.pickedBy = :pickedBy
              AND w.status IN :inFlight
            """)
    int markProcessing(@Param("batch") long l1BatchNumber,
                       @Param("round") AggregationRound round,
                       @Param("pickedBy") String pickedBy,
                       @Param("inFlight") Collection<WitnessJobStatus> inFlight,
                       @Param("processing") WitnessJobStatus processing,
                       @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.heartbeatAt = :now,
                w.updatedAt = :now
            WHERE w.l1BatchNumber = :batch
              AND w.round = :round
              AND w.pickedBy = :pickedBy
              AND w.status IN :inFlight
            """)
    int heartbeat(@Param("batch") long l1BatchNumber,
                  @Param("round") AggregationRound round,
                  @Param("pickedBy") String pickedBy,
                  @Param("inFlight") Collection<WitnessJobStatus> inFlight,
                  @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.status = :failed,
                w.errorKind = :kind,
                w.errorMessage = :error,
                w.updatedAt = :now
            WHERE w.l1BatchNumber = :batch
              AND w.round = :round
              AND w.pickedBy = :pickedBy
              AND w.status IN :inFlight
            """)
    int markFailed(@Param("batch") long l1BatchNumber,
                   @Param("round") AggregationRound round,
                   @Param("pickedBy") String pickedBy,
                   @Param("inFlight") Collection<WitnessJobStatus> inFlight,
                   @Param("failed") WitnessJobStatus failed,
                   @Param("kind") FailureKind kind,
                   @Param("error") String error,
                   @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.status = :successful,
                w.timeTakenMs = :timeTakenMs,
                w.errorKind = NULL,
                w.errorMessage = NULL,
                w.updatedAt = :now
            WHERE w.l1BatchNumber = :batch
              AND w.round = :round
              AND w.pickedBy = :pickedBy
              AND w.status IN :inFlight
            """)
    int markSuccessful(@Param("batch") long l1BatchNumber,
                       @Param("round") AggregationRound round,
                       @Param("pickedBy") String pickedBy,
                       @Param("inFlight") Collection<WitnessJobStatus> inFlight,
                       @Param("successful") WitnessJobStatus successful,
                       @Param("timeTakenMs") long timeTakenMs,
                       @Param("now") Instant now);

    /**
     * Put in-flight jobs whose heartbeat stopped, and transient failures, back in the queue.
     * Jobs that have used up their attempts stay where they are.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WitnessJob w
            SET w.status = :queued,
                w.pickedBy = NULL,
                w.updatedAt = :now
            WHERE w.round = :round
              AND w.attempts < :maxAttempts
              AND ((w.status IN :inFlight AND w.heartbeatAt < :cutoff)
                   OR (w.status = :failed AND w.errorKind IN :retryable))
            """)
    int requeue(@Param("round") AggregationRound round,
                @Param("maxAttempts") int maxAttempts,
                @Param("inFlight") Collection<WitnessJobStatus> inFlight,
                @Param("cutoff") Instant cutoff,
                @Param("failed") WitnessJobStatus failed,
                @Param("retryable") Collection<FailureKind> retryable,
                @Param("queued") WitnessJobStatus queued,
                @Param("now") Instant now);
}
