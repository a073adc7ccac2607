package com.proofmill.witness.circuit;

/** Commitment to the leaf-layer verification key of one base circuit type. */
public record LeafLayerParameters(int circuitType, String vkCommitment) {}
