package com.proofmill.witness.service;

import com.proofmill.witness.model.*;
import com.proofmill.witness.repository.ProverJobRepository;
import com.proofmill.witness.repository.WitnessJobDependencyRepository;
import com.proofmill.witness.repository.WitnessJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The witness-job ledger.
 *
 * Every method is one transaction. Multi-row changes (completing a job)
 * therefore become visible to other engine instances all at once or not at all.
 */
@Service
public class WitnessJobQueue {

    private static final Logger log = LoggerFactory.getLogger(WitnessJobQueue.class);

    // How many ready candidates to look at per claim. Losing a CAS race on one
    // candidate moves on to the next instead of returning empty.
    private static final int CLAIM_CANDIDATES = 8;

    // Error messages are stored in a TEXT column but there is no point keeping stack-sized strings.
    private static final int MAX_ERROR_LENGTH = 4000;

    private static final List<WitnessJobStatus> IN_FLIGHT =
            List.of(WitnessJobStatus.PICKED, WitnessJobStatus.PROCESSING);

    private final WitnessJobRepository           jobRepo;
    private final WitnessJobDependencyRepository dependencyRepo;
    private final ProverJobRepository            proverJobRepo;

    public WitnessJobQueue(WitnessJobRepository jobRepo,
                           WitnessJobDependencyRepository dependencyRepo,
                           ProverJobRepository proverJobRepo) {
        this.jobRepo        = jobRepo;
        this.dependencyRepo = dependencyRepo;
        this.proverJobRepo  = proverJobRepo;
    }

    // ------------------------------------------------------------------
    // Upstream hand-off
    // ------------------------------------------------------------------

    /**
     * Create the QUEUED witness job for (batch, round). Idempotent: an existing row is returned unchanged.
     */
    @Transactional
    public WitnessJob insertWitnessJob(long l1BatchNumber, AggregationRound round) {
        return jobRepo.findByL1BatchNumberAndRound(l1BatchNumber, round)
                .orElseGet(() -> {
                    log.info("Queued {} witness job for batch {}", round, l1BatchNumber);
                    return jobRepo.save(new WitnessJob(l1BatchNumber, round));
                });
    }

    /**
     * Point dependency slot {@code circuitId} of (batch, round) at an upstream prover job.
     * Re-recording a slot replaces its prover job.
     */
    @Transactional
    public void recordDependency(long l1BatchNumber, AggregationRound round, int circuitId, long proverJobId) {
        WitnessJobDependency dep = dependencyRepo
                .findByL1BatchNumberAndRoundAndCircuitId(l1BatchNumber, round, circuitId)
                .orElseGet(() -> new WitnessJobDependency(l1BatchNumber, round, circuitId, null));
        dep.setProverJobId(proverJobId);
        dependencyRepo.save(dep);
    }

    // ------------------------------------------------------------------
    // Claiming
    // ------------------------------------------------------------------

    /**
     * Claim the oldest ready job of {@code round}.
     *
     * Ready means QUEUED with exactly {@code expectedDependencies} dependency
     * slots pointing at SUCCESSFUL prover jobs. The claim itself is a
     * compare-and-set on the status column, so concurrent callers (threads or
     * other processes) never win the same job.
     *
     * @return the claimed batch number, or empty if nothing is ready
     */
    @Transactional
    public Optional<Long> claimNextReadyJob(AggregationRound round, String pickedBy, int expectedDependencies) {
        List<Long> candidates = jobRepo.findReadyBatchNumbers(
                round, WitnessJobStatus.QUEUED, ProverJobStatus.SUCCESSFUL,
                expectedDependencies, PageRequest.of(0, CLAIM_CANDIDATES));
        for (Long batch : candidates) {
            int won = jobRepo.markPicked(batch, round, pickedBy, Instant.now(),
                    WitnessJobStatus.QUEUED, WitnessJobStatus.PICKED);
            if (won == 1) {
                log.info("'{}' claimed {} witness job for batch {}", pickedBy, round, batch);
                return Optional.of(batch);
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Job progress
    // ------------------------------------------------------------------

    /** Dependency slots of a job, in slot order. */
    @Transactional(readOnly = true)
    public List<WitnessJobDependency> dependencies(long l1BatchNumber, AggregationRound round) {
        return dependencyRepo.findByL1BatchNumberAndRoundOrderByCircuitIdAsc(l1BatchNumber, round);
    }

    @Transactional(readOnly = true)
    public List<ProverJob> proverJobs(List<Long> ids) {
        return proverJobRepo.findAllById(ids);
    }

    @Transactional(readOnly = true)
    public Optional<WitnessJob> findJob(long l1BatchNumber, AggregationRound round) {
        return jobRepo.findByL1BatchNumberAndRound(l1BatchNumber, round);
    }

    /**
     * PICKED → PROCESSING, and the first heartbeat.
     *
     * @throws LeaseLostException if {@code pickedBy} no longer owns the job
     */
    @Transactional
    public void markProcessing(long l1BatchNumber, AggregationRound round, String pickedBy) {
        int updated = jobRepo.markProcessing(l1BatchNumber, round, pickedBy,
                IN_FLIGHT, WitnessJobStatus.PROCESSING, Instant.now());
        requireOwned(updated, l1BatchNumber, round, pickedBy);
    }

    /**
     * Tell the ledger the owner is still working on the job.
     *
     * @return false if the job was lost to the requeue policy; the caller's
     *         remaining writes for it will be rejected
     */
    @Transactional
    public boolean heartbeat(long l1BatchNumber, AggregationRound round, String pickedBy) {
        return jobRepo.heartbeat(l1BatchNumber, round, pickedBy, IN_FLIGHT, Instant.now()) == 1;
    }

    /**
     * Record a failed attempt. Any artifact already written is left in place;
     * a retry overwrites it under the same key.
     *
     * @throws LeaseLostException if {@code pickedBy} no longer owns the job
     */
    @Transactional
    public void markFailed(long l1BatchNumber, AggregationRound round, String pickedBy,
                           String error, FailureKind kind) {
        int updated = jobRepo.markFailed(l1BatchNumber, round, pickedBy, IN_FLIGHT,
                WitnessJobStatus.FAILED, kind, truncate(error), Instant.now());
        requireOwned(updated, l1BatchNumber, round, pickedBy);
        log.warn("{} witness job for batch {} FAILED ({}): {}", round, l1BatchNumber, kind, error);
    }

    /**
     * Insert the prover job the artifact unblocks and mark the witness job SUCCESSFUL, atomically.
     *
     * The status change is fenced on the owner, and nothing is inserted
     * unless it succeeds. The insert is an upsert on the prover job's natural
     * key, so a row left by an earlier attempt is reused rather than duplicated.
     *
     * @throws LeaseLostException if {@code pickedBy} no longer owns the job
     */
    @Transactional
    public ProverJob completeJob(long l1BatchNumber, AggregationRound round, String pickedBy,
                                 Duration elapsed, ProverJobInsert next) {
        int updated = jobRepo.markSuccessful(l1BatchNumber, round, pickedBy, IN_FLIGHT,
                WitnessJobStatus.SUCCESSFUL, elapsed.toMillis(), Instant.now());
        requireOwned(updated, l1BatchNumber, round, pickedBy);

        ProverJob proverJob = proverJobRepo
                .findByL1BatchNumberAndRoundAndCircuitIdAndDepthAndSequenceNumber(
                        next.l1BatchNumber(), next.round(), next.circuitId(), next.depth(), next.sequenceNumber())
                .map(existing -> {
                    existing.setCircuitBlobUrl(next.circuitBlobUrl());
                    return existing;
                })
                .orElseGet(() -> new ProverJob(next.l1BatchNumber(), next.circuitId(), next.round(),
                        next.sequenceNumber(), next.depth(), next.circuitBlobUrl(), next.nodeFinalProof()));
        proverJob = proverJobRepo.save(proverJob);

        log.info("{} witness job for batch {} SUCCESSFUL in {} ms; queued prover job {}",
                round, l1BatchNumber, elapsed.toMillis(), proverJob.getId());
        return proverJob;
    }

    // ------------------------------------------------------------------
    // Retry policy
    // ------------------------------------------------------------------

    /**
     * Put stalled and transiently failed jobs back to QUEUED.
     *
     * A job counts as stalled when it is PICKED or PROCESSING and its owner has
     * not sent a heartbeat for longer than {@code stallTimeout}. Input-contract and compute failures are
     * never requeued. Jobs with {@code maxAttempts} claims behind them stay put.
     *
     * @return number of jobs requeued
     */
    @Transactional
    public int requeueStuckJobs(AggregationRound round, Duration stallTimeout, int maxAttempts) {
        Instant now = Instant.now();
        int requeued = jobRepo.requeue(round, maxAttempts,
                IN_FLIGHT,
                now.minus(stallTimeout),
                WitnessJobStatus.FAILED,
                retryableKinds(),
                WitnessJobStatus.QUEUED,
                now);
        if (requeued > 0) {
            log.warn("Requeued {} {} witness job(s)", requeued, round);
        }
        return requeued;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void requireOwned(int updated, long l1BatchNumber, AggregationRound round, String pickedBy) {
        if (updated != 1) {
            throw new LeaseLostException(l1BatchNumber, round, pickedBy);
        }
    }

    private static List<FailureKind> retryableKinds() {
        return Arrays.stream(FailureKind.values())
                .filter(FailureKind::isRetryable)
                .toList();
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
