package com.proofmill.witness.objectstore;

/** Location of the proof produced by a prover job. */
public record ProofKey(long proverJobId) implements BlobKey {

    @Override
    public Bucket bucket() { return Bucket.PROOFS; }

    @Override
    public String objectName() { return "proof_" + proverJobId + ".bin"; }
}
