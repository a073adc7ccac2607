package com.proofmill.witness.processor;

import com.proofmill.witness.circuit.ProofArtifact;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.FailureKind;
import com.proofmill.witness.objectstore.BlobDecodeException;
import com.proofmill.witness.objectstore.ObjectStoreClient;
import com.proofmill.witness.objectstore.ObjectStoreException;
import com.proofmill.witness.objectstore.ProofKey;
import com.proofmill.witness.service.DependencyResolver;
import com.proofmill.witness.service.LeaseLostException;
import com.proofmill.witness.service.ProverJobInsert;
import com.proofmill.witness.service.WitnessJobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Generic job processor: claims one job at a time for its stage's round,
 * prepares it, runs the CPU-bound compute on a worker pool, and records the
 * outcome in the ledger.
 *
 * Per job:
 *   1. claim a ready job (atomic in the ledger)
 *   2. resolve upstream prover jobs and fetch their proofs
 *   3. stage.prepare → mark PROCESSING
 *   4. stage.compute on a worker thread
 *   5. store the artifact, then one transaction: insert next-stage job + mark SUCCESSFUL
 *
 * Any failure in 2-5 is recorded with saveFailure and never escapes
 * {@link #pollOnce()}, so the polling loop keeps going.
 *
 * Every ledger write carries this processor's worker id. While a job is in
 * flight, {@link #heartbeatInFlight()} keeps its lease alive; if the lease is
 * lost anyway, the ledger rejects the late writes and the outcome is dropped.
 *
 * Emitted metrics (tag aggregation_round):
 * <pre>
 *   prover_fri.witness_generation.blob_fetch_time
 *   prover_fri.witness_generation.prepare_job_time
 *   prover_fri.witness_generation.witness_generation_time
 *   prover_fri.witness_generation.blob_save_time
 *   prover_fri.witness_generation.failures{kind}
 * </pre>
 */
public class WitnessJobProcessor<J, A> {

    private static final Logger log = LoggerFactory.getLogger(WitnessJobProcessor.class);

    private static final String METRIC_PREFIX = "prover_fri.witness_generation.";

    private final WitnessStage<J, A>  stage;
    private final WitnessJobQueue     queue;
    private final DependencyResolver  resolver;
    private final ObjectStoreClient   objectStore;
    private final ExecutorService     workers;
    private final MeterRegistry       meterRegistry;
    private final String              workerId;
    private final String              roundTag;

    // One permit per worker thread: a job is only claimed when a worker is free to compute it.
    private final Semaphore capacity;

    // Batches claimed by this processor whose outcome is not yet recorded.
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public WitnessJobProcessor(WitnessStage<J, A> stage,
                               WitnessJobQueue queue,
                               DependencyResolver resolver,
                               ObjectStoreClient objectStore,
                               ExecutorService workers,
                               int workerCount,
                               MeterRegistry meterRegistry) {
        this.stage         = stage;
        this.queue         = queue;
        this.resolver      = resolver;
        this.objectStore   = objectStore;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
        this.capacity      = new Semaphore(workerCount);
        this.workerId      = stage.serviceName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.roundTag      = stage.round().name();
    }

    public AggregationRound round() { return stage.round(); }

    public String workerId() { return workerId; }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /**
     * Claim and start at most one job.
     *
     * Returns immediately once compute has been handed to a worker. The
     * returned future completes after the result or failure has been recorded
     * and never completes exceptionally.
     *
     * @return the in-flight job, or empty if all workers are busy or nothing is ready
     */
    public Optional<CompletableFuture<Void>> pollOnce() {
        if (!capacity.tryAcquire()) {
            return Optional.empty();
        }
        boolean dispatched = false;
        try {
            Optional<Long> claimed = claimNext();
            if (claimed.isEmpty()) {
                return Optional.empty();
            }
            long batch = claimed.get();
            inFlight.add(batch);
            CompletableFuture<Void> job = start(batch);
            dispatched = true;
            return Optional.of(job.whenComplete((ignored, t) -> {
                inFlight.remove(batch);
                capacity.release();
            }));
        } finally {
            if (!dispatched) {
                capacity.release();
            }
        }
    }

    private Optional<Long> claimNext() {
        try {
            return queue.claimNextReadyJob(stage.round(), workerId, stage.expectedDependencyCount());
        } catch (RuntimeException e) {
            log.error("Could not claim next {} job: {}", roundTag, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Refresh the lease of every job this processor has in flight.
     * Called on a fixed schedule, independent of the polling loop.
     */
    public void heartbeatInFlight() {
        for (Long batch : inFlight) {
            try {
                if (!queue.heartbeat(batch, stage.round(), workerId)) {
                    withMdc(batch, () -> log.warn("{} batch {} is no longer owned by '{}'; its outcome will be dropped",
                            roundTag, batch, workerId));
                }
            } catch (RuntimeException e) {
                log.error("Heartbeat for {} batch {} failed: {}", roundTag, batch, e.getMessage(), e);
            }
        }
    }

    /** Batches claimed by this processor that are still being worked on. */
    public Set<Long> inFlightBatches() {
        return Set.copyOf(inFlight);
    }

    private CompletableFuture<Void> start(long batch) {
        Instant startedAt = Instant.now();
        J job;
        putMdc(batch);
        try {
            log.info("Starting {} witness generation for batch {}", roundTag, batch);
            job = loadJob(batch);
            queue.markProcessing(batch, stage.round(), workerId);
        } catch (RuntimeException e) {
            saveFailure(batch, startedAt, e);
            return CompletableFuture.completedFuture(null);
        } finally {
            removeMdc();
        }

        return CompletableFuture
                .supplyAsync(() -> process(batch, job), workers)
                .thenAccept(artifacts -> saveResult(batch, startedAt, artifacts))
                .exceptionally(t -> {
                    saveFailure(batch, startedAt, t);
                    return null;
                });
    }

    // ------------------------------------------------------------------
    // get_next_job: resolve, fetch, prepare
    // ------------------------------------------------------------------

    private J loadJob(long batch) {
        List<Long> proverJobIds = resolver.resolve(batch, stage.round(), stage.expectedDependencyCount());

        Timer.Sample fetch = Timer.start(meterRegistry);
        List<ProofArtifact> proofs = new ArrayList<>(proverJobIds.size());
        for (Long id : proverJobIds) {
            proofs.add(objectStore.get(new ProofKey(id), ProofArtifact.class));
        }
        fetch.stop(timer("blob_fetch_time"));

        Timer.Sample prepare = Timer.start(meterRegistry);
        J job = stage.prepare(batch, proofs);
        prepare.stop(timer("prepare_job_time"));
        return job;
    }

    // ------------------------------------------------------------------
    // process_job: runs on a worker thread
    // ------------------------------------------------------------------

    private A process(long batch, J job) {
        putMdc(batch);
        try {
            Timer.Sample compute = Timer.start(meterRegistry);
            A artifacts = stage.compute(job);
            compute.stop(timer("witness_generation_time"));
            return artifacts;
        } finally {
            // Worker threads are pooled; never leak context into the next job.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // save_result / save_failure
    // ------------------------------------------------------------------

    private void saveResult(long batch, Instant startedAt, A artifacts) {
        Timer.Sample save = Timer.start(meterRegistry);
        String blobUrl = objectStore.put(stage.artifactKey(batch), artifacts);
        save.stop(timer("blob_save_time"));

        ProverJobInsert next = stage.onSuccess(batch, blobUrl);
        Duration elapsed = Duration.between(startedAt, Instant.now());
        queue.completeJob(batch, stage.round(), workerId, elapsed, next);
        withMdc(batch, () -> log.info("{} witness generation for batch {} complete in {} ms",
                roundTag, batch, elapsed.toMillis()));
    }

    private void saveFailure(long batch, Instant startedAt, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof LeaseLostException lost) {
            // Someone else owns the job now; its outcome is theirs to record.
            withMdc(batch, () -> log.warn("Dropping outcome of {} batch {}: {}", roundTag, batch, lost.getMessage()));
            return;
        }
        WitnessGenerationException failure = classify(cause);
        Duration elapsed = Duration.between(startedAt, Instant.now());
        meterRegistry.counter(METRIC_PREFIX + "failures",
                "aggregation_round", roundTag,
                "kind", failure.getKind().name().toLowerCase()).increment();
        try {
            queue.markFailed(batch, stage.round(), workerId, failure.getMessage(), failure.getKind());
        } catch (RuntimeException e) {
            // The ledger is unreachable; the requeue policy picks the job up once it times out.
            log.error("Could not record failure of {} batch {} after {} ms: {} (original error: {})",
                    roundTag, batch, elapsed.toMillis(), e.getMessage(), failure.getMessage(), e);
            return;
        }
        stage.onFailure(batch, failure);
    }

    /**
     * Map any exception to a failure kind.
     *
     * Stage-raised WitnessGenerationExceptions keep their kind. A blob that
     * cannot be decoded is a structurally wrong input. Storage and database
     * errors are transient; anything else came out of compute.
     */
    static WitnessGenerationException classify(Throwable t) {
        if (t instanceof WitnessGenerationException wge) {
            return wge;
        }
        if (t instanceof BlobDecodeException) {
            return new WitnessGenerationException(FailureKind.INPUT_CONTRACT_VIOLATION, describe(t), t);
        }
        if (t instanceof ObjectStoreException || t instanceof DataAccessException) {
            return new WitnessGenerationException(FailureKind.TRANSIENT, describe(t), t);
        }
        return new WitnessGenerationException(FailureKind.COMPUTE, describe(t), t);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private Timer timer(String name) {
        return meterRegistry.timer(METRIC_PREFIX + name, "aggregation_round", roundTag);
    }

    private void withMdc(long batch, Runnable action) {
        putMdc(batch);
        try {
            action.run();
        } finally {
            removeMdc();
        }
    }

    private void putMdc(long batch) {
        MDC.put("l1BatchNumber", String.valueOf(batch));
        MDC.put("round", roundTag);
    }

    private void removeMdc() {
        MDC.remove("l1BatchNumber");
        MDC.remove("round");
    }
}
