package com.proofmill.witness.service;

import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.ProverJob;
import com.proofmill.witness.model.ProverJobStatus;
import com.proofmill.witness.model.WitnessJobDependency;
import com.proofmill.witness.processor.WitnessGenerationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps a witness job to the upstream prover jobs whose proofs it consumes.
 *
 * The returned order is the slot order (ascending circuit id). The compute
 * step matches proofs to circuits by position, so the order must never be
 * changed or padded. Anything that does not line up with the expected
 * topology is an input-contract violation.
 */
@Component
public class DependencyResolver {

    private final WitnessJobQueue queue;

    public DependencyResolver(WitnessJobQueue queue) {
        this.queue = queue;
    }

    /**
     * @param expectedCount number of dependency slots the round's topology requires
     * @return prover job ids in slot order, exactly {@code expectedCount} of them
     * @throws WitnessGenerationException with INPUT_CONTRACT_VIOLATION if the recorded slots do not match
     */
    public List<Long> resolve(long l1BatchNumber, AggregationRound round, int expectedCount) {
        List<WitnessJobDependency> slots = queue.dependencies(l1BatchNumber, round);
        if (slots.size() != expectedCount) {
            throw WitnessGenerationException.inputContractViolation(
                    "Expected " + expectedCount + " dependencies for " + round + " batch " + l1BatchNumber
                    + ", found " + slots.size());
        }

        List<Long> ids = new ArrayList<>(slots.size());
        Set<Integer> seenCircuits = new HashSet<>();
        for (WitnessJobDependency slot : slots) {
            if (!seenCircuits.add(slot.getCircuitId())) {
                throw WitnessGenerationException.inputContractViolation(
                        "Circuit " + slot.getCircuitId() + " recorded twice for " + round + " batch " + l1BatchNumber);
            }
            if (slot.getProverJobId() == null) {
                throw WitnessGenerationException.inputContractViolation(
                        "No prover job for circuit " + slot.getCircuitId() + " of " + round + " batch " + l1BatchNumber);
            }
            ids.add(slot.getProverJobId());
        }

        checkUpstream(l1BatchNumber, round, ids);
        return ids;
    }

    private void checkUpstream(long l1BatchNumber, AggregationRound round, List<Long> ids) {
        AggregationRound upstream = round.previous();
        Map<Long, ProverJob> byId = queue.proverJobs(ids).stream()
                .collect(Collectors.toMap(ProverJob::getId, Function.identity()));
        for (Long id : ids) {
            ProverJob job = byId.get(id);
            if (job == null) {
                throw WitnessGenerationException.inputContractViolation(
                        "Prover job " + id + " referenced by " + round + " batch " + l1BatchNumber + " does not exist");
            }
            if (job.getStatus() != ProverJobStatus.SUCCESSFUL) {
                throw WitnessGenerationException.inputContractViolation(
                        "Prover job " + id + " is " + job.getStatus() + ", expected SUCCESSFUL");
            }
            if (job.getRound() != upstream) {
                throw WitnessGenerationException.inputContractViolation(
                        "Prover job " + id + " belongs to " + job.getRound() + ", " + round
                        + " consumes only " + upstream + " proofs");
            }
        }
    }
}
