package com.proofmill.witness.circuit;

/** Proof of a recursive (leaf, node or scheduler) circuit. {@code proof} is opaque. */
public record RecursionLayerProof(int circuitType, String proof) implements ProofArtifact {}
