package com.proofmill.witness.objectstore;

/**
 * Top-level namespaces of the object store. The names are persisted.
 */
public enum Bucket {
    PROVER_JOBS("prover_jobs_fri"),
    PROOFS("proofs_fri"),
    SCHEDULER_WITNESS_JOBS("scheduler_witness_jobs_fri");

    private final String dirName;

    Bucket(String dirName) {
        this.dirName = dirName;
    }

    public String dirName() { return dirName; }
}
