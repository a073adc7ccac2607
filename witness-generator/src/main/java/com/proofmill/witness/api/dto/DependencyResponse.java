package com.proofmill.witness.api.dto;

import com.proofmill.witness.model.ProverJobStatus;

/**
 * One dependency slot of a witness job. {@code proverJobStatus} is null while
 * the slot has no prover job.
 */
public record DependencyResponse(int circuitId, Long proverJobId, ProverJobStatus proverJobStatus) {}
