package com.proofmill.witness.circuit;

/** Proof of a basic circuit. {@code proof} is opaque. */
public record BaseLayerProof(int circuitType, String proof) implements ProofArtifact {}
