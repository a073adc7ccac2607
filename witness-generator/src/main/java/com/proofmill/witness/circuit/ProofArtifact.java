package com.proofmill.witness.circuit;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * A proof as stored by a prover job: either a base-layer proof (from the
 * basic circuits) or a recursion-layer proof (from any aggregation round).
 *
 * Stored with a {@code kind} discriminator so a reader can tell the two
 * apart without knowing which round produced the blob.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BaseLayerProof.class,      name = "base"),
        @JsonSubTypes.Type(value = RecursionLayerProof.class, name = "recursive")
})
public interface ProofArtifact {

    int circuitType();

    /** The recursion-layer proof, or empty if this is a base-layer proof. */
    default Optional<RecursionLayerProof> asRecursive() {
        return this instanceof RecursionLayerProof r ? Optional.of(r) : Optional.empty();
    }
}
