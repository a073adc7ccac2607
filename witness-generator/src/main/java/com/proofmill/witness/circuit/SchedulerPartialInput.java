package com.proofmill.witness.circuit;

import java.util.List;

/**
 * Scheduler witness as written by the basic-circuits round.
 *
 * {@code blockWitness} carries the batch data and is opaque here. The other
 * three fields are empty or stale when the blob is written and are filled in
 * by the scheduler stage just before compute.
 */
public record SchedulerPartialInput(
        String                    blockWitness,
        VerificationKey           nodeLayerVkWitness,
        List<RecursionLayerProof> proofWitnesses,
        List<LeafLayerParameters> leafLayerParameters
) {
    public SchedulerPartialInput {
        proofWitnesses      = proofWitnesses      == null ? List.of() : List.copyOf(proofWitnesses);
        leafLayerParameters = leafLayerParameters == null ? List.of() : List.copyOf(leafLayerParameters);
    }

    public SchedulerPartialInput withNodeLayerVkWitness(VerificationKey vk) {
        return new SchedulerPartialInput(blockWitness, vk, proofWitnesses, leafLayerParameters);
    }

    public SchedulerPartialInput withProofWitnesses(List<RecursionLayerProof> proofs) {
        return new SchedulerPartialInput(blockWitness, nodeLayerVkWitness, proofs, leafLayerParameters);
    }

    public SchedulerPartialInput withLeafLayerParameters(List<LeafLayerParameters> params) {
        return new SchedulerPartialInput(blockWitness, nodeLayerVkWitness, proofWitnesses, params);
    }
}
