package com.proofmill.witness.circuit;

/**
 * Static configuration baked into a scheduler circuit.
 *
 * @param capacity maximum number of node-layer proofs the circuit can absorb
 */
public record SchedulerConfig(ProofConfig proofConfig, String vkFixedParameters, int capacity) {}
