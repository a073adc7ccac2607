package com.proofmill.witness.service;

import com.proofmill.witness.model.AggregationRound;

/**
 * The prover job a successful witness job unblocks.
 */
public record ProverJobInsert(
        long             l1BatchNumber,
        int              circuitId,
        long             sequenceNumber,
        int              depth,
        AggregationRound round,
        String           circuitBlobUrl,
        boolean          nodeFinalProof
) {}
