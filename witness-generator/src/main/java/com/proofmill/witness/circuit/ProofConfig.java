package com.proofmill.witness.circuit;

/** FRI proof parameters used by a circuit layer. */
public record ProofConfig(int friLdeFactor, int merkleTreeCapSize, int securityLevel, int powBits) {

    /** Parameters shared by all recursion-layer circuits. */
    public static ProofConfig recursionLayer() {
        return new ProofConfig(2, 16, 100, 0);
    }
}
