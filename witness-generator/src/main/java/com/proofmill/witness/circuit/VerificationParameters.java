package com.proofmill.witness.circuit;

import java.util.List;

/**
 * Fixed verification parameters of the recursion layer.
 *
 * Loaded once at startup (see VerificationKeyConfiguration) and shared
 * read-only by every job the process runs.
 *
 * @param nodeLayerVk         key of the node-aggregation circuit, whose proofs the scheduler consumes
 * @param leafLayerParameters one entry per base circuit type, in circuit-type order
 */
public record VerificationParameters(VerificationKey nodeLayerVk, List<LeafLayerParameters> leafLayerParameters) {

    public VerificationParameters {
        if (nodeLayerVk == null) throw new IllegalArgumentException("nodeLayerVk is required");
        leafLayerParameters = List.copyOf(leafLayerParameters);
    }
}
