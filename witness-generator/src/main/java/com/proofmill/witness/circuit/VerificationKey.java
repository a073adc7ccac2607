package com.proofmill.witness.circuit;

/**
 * Verification key of a recursion-layer circuit.
 *
 * @param circuitType      recursion-layer circuit type the key belongs to
 * @param fixedParameters  the part of the key that the scheduler config embeds
 * @param setupMerkleTreeCap commitment to the setup data
 */
public record VerificationKey(int circuitType, String fixedParameters, String setupMerkleTreeCap) {}
