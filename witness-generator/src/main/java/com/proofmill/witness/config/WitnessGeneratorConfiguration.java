package com.proofmill.witness.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmill.witness.circuit.VerificationParameters;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.objectstore.FileBackedObjectStore;
import com.proofmill.witness.objectstore.ObjectStore;
import com.proofmill.witness.objectstore.ObjectStoreClient;
import com.proofmill.witness.processor.WitnessJobProcessor;
import com.proofmill.witness.processor.WitnessStage;
import com.proofmill.witness.scheduler.SchedulerWitnessStage;
import com.proofmill.witness.service.DependencyResolver;
import com.proofmill.witness.service.WitnessJobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the job processor for the round this process serves.
 *
 * The stage is chosen once from {@code witness.round}; one process serves one round.
 */
@Configuration
public class WitnessGeneratorConfiguration {

    @Bean
    ObjectStore objectStore(@Value("${witness.object-store.base-path}") Path basePath) {
        return new FileBackedObjectStore(basePath);
    }

    @Bean
    ObjectStoreClient objectStoreClient(ObjectStore objectStore, ObjectMapper objectMapper) {
        return new ObjectStoreClient(objectStore, objectMapper);
    }

    /**
     * Bounded pool for CPU-bound compute. Each worker builds one circuit at a time.
     */
    @Bean(destroyMethod = "shutdown")
    ExecutorService witnessWorkers(@Value("${witness.workers}") int workerCount) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "witness-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workerCount, factory);
    }

    @Bean
    WitnessStage<?, ?> witnessStage(@Value("${witness.round}") AggregationRound round,
                                    @Value("${witness.topology.recursive-circuit-count}") int recursiveCircuitCount,
                                    @Value("${witness.scheduler.capacity}") int schedulerCapacity,
                                    ObjectStoreClient objectStoreClient,
                                    VerificationParameters verificationParameters,
                                    ObjectMapper objectMapper) {
        return switch (round) {
            case SCHEDULER -> new SchedulerWitnessStage(objectStoreClient, verificationParameters,
                    recursiveCircuitCount, schedulerCapacity, objectMapper);
            case BASIC_CIRCUITS, LEAF_AGGREGATION, NODE_AGGREGATION ->
                    throw new IllegalStateException("Round " + round + " is not served by this witness generator");
        };
    }

    @Bean
    WitnessJobProcessor<?, ?> witnessJobProcessor(WitnessStage<?, ?> stage,
                                                  WitnessJobQueue queue,
                                                  DependencyResolver resolver,
                                                  ObjectStoreClient objectStoreClient,
                                                  @Qualifier("witnessWorkers") ExecutorService workers,
                                                  @Value("${witness.workers}") int workerCount,
                                                  MeterRegistry meterRegistry) {
        return processorFor(stage, queue, resolver, objectStoreClient, workers, workerCount, meterRegistry);
    }

    private static <J, A> WitnessJobProcessor<J, A> processorFor(WitnessStage<J, A> stage,
                                                                 WitnessJobQueue queue,
                                                                 DependencyResolver resolver,
                                                                 ObjectStoreClient objectStoreClient,
                                                                 ExecutorService workers,
                                                                 int workerCount,
                                                                 MeterRegistry meterRegistry) {
        return new WitnessJobProcessor<>(stage, queue, resolver, objectStoreClient, workers, workerCount, meterRegistry);
    }
}
