package com.proofmill.witness.model;

/**
 * Lifecycle of a witness-generation job row.
 *
 * Transitions:
 *   QUEUED     → PICKED      (claimed by exactly one engine instance)
 *   PICKED     → PROCESSING  (dependencies fetched, compute dispatched)
 *   PROCESSING → SUCCESSFUL  (artifact stored, next-stage job inserted)
 *   any        → FAILED      (error recorded with its FailureKind)
 *
 * Nothing in the engine moves a job back to QUEUED; that is the
 * requeue policy's decision (see StuckJobRequeuer).
 */
public enum WitnessJobStatus {
    QUEUED,
    PICKED,
    PROCESSING,
    SUCCESSFUL,
    FAILED
}
