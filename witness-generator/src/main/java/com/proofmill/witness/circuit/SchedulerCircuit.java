package com.proofmill.witness.circuit;

/**
 * The terminal circuit of a batch, handed to the prover.
 *
 * @param witnessCommitment hex SHA-256 of the encoded witness; lets the prover
 *                          detect a blob that does not match its inputs
 */
public record SchedulerCircuit(
        long                  l1BatchNumber,
        SchedulerPartialInput witness,
        SchedulerConfig       config,
        String                witnessCommitment
) {}
