package com.proofmill.witness.model;

/**
 * Status of a prover job.
 *
 * Upstream prover jobs must be SUCCESSFUL before a witness job that
 * depends on them becomes claimable.
 */
public enum ProverJobStatus {
    QUEUED,
    IN_PROGRESS,
    SUCCESSFUL,
    FAILED
}
