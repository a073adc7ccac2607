package com.proofmill.witness.scheduler;

import com.proofmill.witness.circuit.SchedulerPartialInput;
import com.proofmill.witness.circuit.VerificationKey;

/**
 * A fully assembled scheduler job: the merged witness plus the node-layer key
 * whose fixed parameters go into the circuit config. Consumed once by compute.
 */
public record SchedulerWitnessJob(long l1BatchNumber, SchedulerPartialInput witness, VerificationKey nodeVk) {}
