package com.proofmill.witness.model;

/**
 * Why a witness job attempt failed.
 *
 * Stored next to the error message so the requeue policy can tell
 * "infrastructure hiccup, retry" apart from "bad data, do not retry".
 */
public enum FailureKind {
    /** Blob store or database unavailable. */
    TRANSIENT(true),
    /** Structurally wrong inputs: wrong proof kind, dependency count mismatch, bad parameter table. */
    INPUT_CONTRACT_VIOLATION(false),
    /** The compute step rejected the assembled job. Inputs are fixed, so a retry gives the same answer. */
    COMPUTE(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
