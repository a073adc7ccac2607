package com.proofmill.witness.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmill.witness.circuit.*;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.FailureKind;
import com.proofmill.witness.objectstore.BlobKey;
import com.proofmill.witness.objectstore.CircuitKey;
import com.proofmill.witness.objectstore.ObjectStoreClient;
import com.proofmill.witness.objectstore.SchedulerPartialInputKey;
import com.proofmill.witness.processor.WitnessGenerationException;
import com.proofmill.witness.processor.WitnessStage;
import com.proofmill.witness.service.ProverJobInsert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * The terminal aggregation round: folds the node-aggregation proofs of a
 * batch into the single scheduler circuit.
 *
 * prepare merges three things into the partial witness written by the
 * basic-circuits round:
 * <ol>
 *   <li>the node-layer verification key (process-wide, read-only),</li>
 *   <li>the node-layer proofs, one per circuit type, in slot order,</li>
 *   <li>the leaf-layer parameter table, whose width is fixed by the topology.</li>
 * </ol>
 * The circuit is stored as circuit 1, sequence 0, depth 0 and queued for
 * final proving. No aggregation round follows this one.
 */
public class SchedulerWitnessStage implements WitnessStage<SchedulerWitnessJob, SchedulerCircuit> {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWitnessStage.class);

    static final int  SCHEDULER_CIRCUIT_ID = 1;
    static final long SEQUENCE_NUMBER      = 0;
    static final int  DEPTH                = 0;

    private final ObjectStoreClient      objectStore;
    private final VerificationParameters parameters;
    private final int                    recursiveCircuitCount;
    private final int                    capacity;
    private final ObjectMapper           json;

    /**
     * @param recursiveCircuitCount number of base circuit types; both the number of
     *                              node-layer proofs and the leaf parameter table width
     * @param capacity              scheduler circuit capacity
     */
    public SchedulerWitnessStage(ObjectStoreClient objectStore,
                                 VerificationParameters parameters,
                                 int recursiveCircuitCount,
                                 int capacity,
                                 ObjectMapper objectMapper) {
        this.objectStore           = objectStore;
        this.parameters            = parameters;
        this.recursiveCircuitCount = recursiveCircuitCount;
        this.capacity              = capacity;
        this.json                  = objectMapper;
    }

    @Override
    public AggregationRound round() { return AggregationRound.SCHEDULER; }

    @Override
    public String serviceName() { return "fri_scheduler_witness_generator"; }

    @Override
    public int expectedDependencyCount() { return recursiveCircuitCount; }

    // ------------------------------------------------------------------
    // prepare
    // ------------------------------------------------------------------

    @Override
    public SchedulerWitnessJob prepare(long l1BatchNumber, List<ProofArtifact> dependencyProofs) {
        SchedulerPartialInput partial =
                objectStore.get(new SchedulerPartialInputKey(l1BatchNumber), SchedulerPartialInput.class);

        VerificationKey nodeVk = parameters.nodeLayerVk();
        List<RecursionLayerProof> proofs = recursiveProofs(l1BatchNumber, dependencyProofs);

        List<LeafLayerParameters> leafParams = parameters.leafLayerParameters();
        if (leafParams.size() != recursiveCircuitCount) {
            throw WitnessGenerationException.inputContractViolation(
                    "Leaf layer parameter table has " + leafParams.size() + " entries, topology requires "
                    + recursiveCircuitCount);
        }

        SchedulerPartialInput witness = partial
                .withNodeLayerVkWitness(nodeVk)
                .withProofWitnesses(proofs)
                .withLeafLayerParameters(leafParams);
        return new SchedulerWitnessJob(l1BatchNumber, witness, nodeVk);
    }

    private List<RecursionLayerProof> recursiveProofs(long l1BatchNumber, List<ProofArtifact> proofs) {
        if (proofs.size() != recursiveCircuitCount) {
            throw WitnessGenerationException.inputContractViolation(
                    "Scheduler batch " + l1BatchNumber + " needs " + recursiveCircuitCount
                    + " node proofs, got " + proofs.size());
        }
        List<RecursionLayerProof> recursive = new ArrayList<>(proofs.size());
        for (int slot = 0; slot < proofs.size(); slot++) {
            ProofArtifact proof = proofs.get(slot);
            int s = slot;
            recursive.add(proof.asRecursive().orElseThrow(() ->
                    WitnessGenerationException.inputContractViolation(
                            "Expected only recursive proofs for scheduler batch " + l1BatchNumber
                            + ", slot " + s + " holds a base layer proof of circuit " + proof.circuitType())));
        }
        return recursive;
    }

    // ------------------------------------------------------------------
    // compute
    // ------------------------------------------------------------------

    @Override
    public SchedulerCircuit compute(SchedulerWitnessJob job) {
        log.info("Building scheduler circuit for batch {} from {} node proofs",
                job.l1BatchNumber(), job.witness().proofWitnesses().size());

        if (job.witness().proofWitnesses().size() > capacity) {
            throw new WitnessGenerationException(FailureKind.COMPUTE,
                    "Batch " + job.l1BatchNumber() + " has " + job.witness().proofWitnesses().size()
                    + " node proofs, scheduler capacity is " + capacity);
        }

        SchedulerConfig config = new SchedulerConfig(
                ProofConfig.recursionLayer(),
                job.nodeVk().fixedParameters(),
                capacity);
        return new SchedulerCircuit(job.l1BatchNumber(), job.witness(), config, commitment(job));
    }

    private String commitment(SchedulerWitnessJob job) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            sha256.update(json.writeValueAsBytes(job.witness()));
            return HexFormat.of().formatHex(sha256.digest());
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new WitnessGenerationException(FailureKind.COMPUTE,
                    "Could not commit to scheduler witness of batch " + job.l1BatchNumber(), e);
        }
    }

    // ------------------------------------------------------------------
    // save
    // ------------------------------------------------------------------

    @Override
    public BlobKey artifactKey(long l1BatchNumber) {
        return new CircuitKey(l1BatchNumber, SCHEDULER_CIRCUIT_ID, SEQUENCE_NUMBER, DEPTH, AggregationRound.SCHEDULER);
    }

    @Override
    public ProverJobInsert onSuccess(long l1BatchNumber, String artifactBlobUrl) {
        return new ProverJobInsert(l1BatchNumber, SCHEDULER_CIRCUIT_ID, SEQUENCE_NUMBER, DEPTH,
                AggregationRound.SCHEDULER, artifactBlobUrl, false);
    }

    @Override
    public void onFailure(long l1BatchNumber, WitnessGenerationException failure) {
        if (failure.getKind() == FailureKind.INPUT_CONTRACT_VIOLATION) {
            log.error("Scheduler batch {} has inconsistent inputs and will not be retried: {}",
                    l1BatchNumber, failure.getMessage());
        }
    }
}
