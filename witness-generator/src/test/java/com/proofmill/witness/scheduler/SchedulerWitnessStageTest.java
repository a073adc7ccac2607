package com.proofmill.witness.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmill.witness.circuit.*;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.FailureKind;
import com.proofmill.witness.objectstore.CircuitKey;
import com.proofmill.witness.objectstore.FileBackedObjectStore;
import com.proofmill.witness.objectstore.ObjectStoreClient;
import com.proofmill.witness.objectstore.ObjectStoreException;
import com.proofmill.witness.objectstore.SchedulerPartialInputKey;
import com.proofmill.witness.processor.WitnessGenerationException;
import com.proofmill.witness.service.ProverJobInsert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the scheduler stage against a file-backed object store.
 */
class SchedulerWitnessStageTest {

    private static final long BATCH = 42;

    private static final VerificationKey NODE_VK =
            new VerificationKey(15, "node-fixed-parameters", "0xcap");

    private static final List<LeafLayerParameters> LEAF_PARAMS = List.of(
            new LeafLayerParameters(1, "0x01"),
            new LeafLayerParameters(2, "0x02"),
            new LeafLayerParameters(3, "0x03"));

    @TempDir Path tempDir;

    ObjectMapper           json = new ObjectMapper();
    ObjectStoreClient      objectStore;
    SchedulerWitnessStage  stage;

    @BeforeEach
    void setUp() {
        objectStore = new ObjectStoreClient(new FileBackedObjectStore(tempDir), json);
        stage = new SchedulerWitnessStage(objectStore, new VerificationParameters(NODE_VK, LEAF_PARAMS), 3, 16, json);
    }

    // ------------------------------------------------------------------
    // prepare
    // ------------------------------------------------------------------

    @Test
    void prepare_mergesProofsKeyAndLeafParametersIntoPartialInput() {
        // The stored partial input carries a stale key and no proofs.
        objectStore.put(new SchedulerPartialInputKey(BATCH), new SchedulerPartialInput(
                "block-42", new VerificationKey(0, "stale", "stale"), null, null));

        SchedulerWitnessJob job = stage.prepare(BATCH, List.of(node(3), node(1), node(2)));

        assertThat(job.l1BatchNumber()).isEqualTo(BATCH);
        assertThat(job.nodeVk()).isEqualTo(NODE_VK);
        assertThat(job.witness().blockWitness()).isEqualTo("block-42");
        assertThat(job.witness().nodeLayerVkWitness()).isEqualTo(NODE_VK);
        assertThat(job.witness().proofWitnesses())
                .extracting(RecursionLayerProof::circuitType)
                .containsExactly(3, 1, 2);
        assertThat(job.witness().leafLayerParameters()).isEqualTo(LEAF_PARAMS);
    }

    @Test
    void prepare_baseLayerProof_inputContractViolation() {
        objectStore.put(new SchedulerPartialInputKey(BATCH), partialInput());

        assertThatThrownBy(() -> stage.prepare(BATCH,
                List.of(node(1), new BaseLayerProof(2, "base-proof"), node(3))))
                .isInstanceOf(WitnessGenerationException.class)
                .hasMessageContaining("Expected only recursive proofs")
                .hasMessageContaining("slot 1")
                .extracting(e -> ((WitnessGenerationException) e).getKind())
                .isEqualTo(FailureKind.INPUT_CONTRACT_VIOLATION);
    }

    @Test
    void prepare_wrongProofCount_inputContractViolation() {
        objectStore.put(new SchedulerPartialInputKey(BATCH), partialInput());

        assertThatThrownBy(() -> stage.prepare(BATCH, List.of(node(1), node(2))))
                .isInstanceOf(WitnessGenerationException.class)
                .hasMessageContaining("needs 3 node proofs, got 2");
    }

    @Test
    void prepare_leafTableOfWrongWidth_inputContractViolation() {
        SchedulerWitnessStage narrow = new SchedulerWitnessStage(objectStore,
                new VerificationParameters(NODE_VK, LEAF_PARAMS.subList(0, 2)), 3, 16, json);
        objectStore.put(new SchedulerPartialInputKey(BATCH), partialInput());

        assertThatThrownBy(() -> narrow.prepare(BATCH, List.of(node(1), node(2), node(3))))
                .isInstanceOf(WitnessGenerationException.class)
                .hasMessageContaining("2 entries, topology requires 3")
                .extracting(e -> ((WitnessGenerationException) e).getKind())
                .isEqualTo(FailureKind.INPUT_CONTRACT_VIOLATION);
    }

    @Test
    void prepare_missingPartialInput_throwsObjectStoreException() {
        assertThatThrownBy(() -> stage.prepare(BATCH, List.of(node(1), node(2), node(3))))
                .isInstanceOf(ObjectStoreException.class);
    }

    // ------------------------------------------------------------------
    // compute
    // ------------------------------------------------------------------

    @Test
    void compute_buildsCircuitWithRecursionLayerConfig() {
        objectStore.put(new SchedulerPartialInputKey(BATCH), partialInput());
        SchedulerWitnessJob job = stage.prepare(BATCH, List.of(node(1), node(2), node(3)));

        SchedulerCircuit circuit = stage.compute(job);

        assertThat(circuit.l1BatchNumber()).isEqualTo(BATCH);
        assertThat(circuit.witness()).isEqualTo(job.witness());
        assertThat(circuit.config().proofConfig()).isEqualTo(ProofConfig.recursionLayer());
        assertThat(circuit.config().vkFixedParameters()).isEqualTo("node-fixed-parameters");
        assertThat(circuit.config().capacity()).isEqualTo(16);
        assertThat(circuit.witnessCommitment()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void compute_sameWitness_sameCommitment() {
        objectStore.put(new SchedulerPartialInputKey(BATCH), partialInput());
        SchedulerWitnessJob job = stage.prepare(BATCH, List.of(node(1), node(2), node(3)));
        SchedulerWitnessJob reordered = stage.prepare(BATCH, List.of(node(2), node(1), node(3)));

        assertThat(stage.compute(job).witnessCommitment()).isEqualTo(stage.compute(job).witnessCommitment());
        assertThat(stage.compute(job).witnessCommitment()).isNotEqualTo(stage.compute(reordered).witnessCommitment());
    }

    @Test
    void compute_moreProofsThanCapacity_computeFailure() {
        SchedulerWitnessStage tiny = new SchedulerWitnessStage(objectStore,
                new VerificationParameters(NODE_VK, LEAF_PARAMS), 3, 2, json);
        SchedulerWitnessJob job = new SchedulerWitnessJob(BATCH,
                partialInput().withProofWitnesses(List.of(node(1), node(2), node(3))), NODE_VK);

        assertThatThrownBy(() -> tiny.compute(job))
                .isInstanceOf(WitnessGenerationException.class)
                .hasMessageContaining("scheduler capacity is 2")
                .extracting(e -> ((WitnessGenerationException) e).getKind())
                .isEqualTo(FailureKind.COMPUTE);
    }

    // ------------------------------------------------------------------
    // save
    // ------------------------------------------------------------------

    @Test
    void artifactKey_isCircuitOneSequenceZeroDepthZero() {
        assertThat(stage.artifactKey(BATCH))
                .isEqualTo(new CircuitKey(BATCH, 1, 0, 0, AggregationRound.SCHEDULER));
        assertThat(stage.artifactKey(BATCH).objectName()).isEqualTo("42_0_1_SCHEDULER_0.bin");
    }

    @Test
    void onSuccess_queuesOneSchedulerProverJob() {
        ProverJobInsert next = stage.onSuccess(BATCH, "42_0_1_SCHEDULER_0.bin");

        assertThat(next).isEqualTo(new ProverJobInsert(BATCH, 1, 0, 0,
                AggregationRound.SCHEDULER, "42_0_1_SCHEDULER_0.bin", false));
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    private static RecursionLayerProof node(int circuitType) {
        return new RecursionLayerProof(circuitType, "node-proof-" + circuitType);
    }

    private static SchedulerPartialInput partialInput() {
        return new SchedulerPartialInput("block-42", null, List.of(), List.of());
    }
}
