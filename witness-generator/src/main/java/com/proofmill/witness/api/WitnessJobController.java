package com.proofmill.witness.api;

import com.proofmill.witness.api.dto.DependencyResponse;
import com.proofmill.witness.api.dto.WitnessJobResponse;
import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.ProverJob;
import com.proofmill.witness.model.WitnessJobDependency;
import com.proofmill.witness.service.WitnessJobQueue;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of the witness-job ledger.
 *
 * GET /witness-jobs/{round}/{l1BatchNumber}               : status of one job
 * GET /witness-jobs/{round}/{l1BatchNumber}/dependencies  : its dependency slots, in slot order
 */
@RestController
@RequestMapping("/witness-jobs")
public class WitnessJobController {

    private final WitnessJobQueue queue;

    public WitnessJobController(WitnessJobQueue queue) {
        this.queue = queue;
    }

    /**
     * Example:
     *   curl http://localhost:8080/witness-jobs/SCHEDULER/42
     */
    @GetMapping("/{round}/{l1BatchNumber}")
    public WitnessJobResponse getJob(@PathVariable AggregationRound round, @PathVariable long l1BatchNumber) {
        return queue.findJob(l1BatchNumber, round)
                .map(WitnessJobResponse::from)
                .orElseThrow(() -> notFound(round, l1BatchNumber));
    }

    @GetMapping("/{round}/{l1BatchNumber}/dependencies")
    public List<DependencyResponse> getDependencies(@PathVariable AggregationRound round,
                                                    @PathVariable long l1BatchNumber) {
        queue.findJob(l1BatchNumber, round).orElseThrow(() -> notFound(round, l1BatchNumber));

        List<WitnessJobDependency> slots = queue.dependencies(l1BatchNumber, round);
        List<Long> ids = slots.stream()
                .map(WitnessJobDependency::getProverJobId)
                .filter(Objects::nonNull)
                .toList();
        Map<Long, ProverJob> proverJobs = queue.proverJobs(ids).stream()
                .collect(Collectors.toMap(ProverJob::getId, Function.identity()));

        return slots.stream()
                .map(d -> {
                    ProverJob p = d.getProverJobId() == null ? null : proverJobs.get(d.getProverJobId());
                    return new DependencyResponse(d.getCircuitId(), d.getProverJobId(),
                            p == null ? null : p.getStatus());
                })
                .toList();
    }

    private static ResponseStatusException notFound(AggregationRound round, long l1BatchNumber) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND,
                "No " + round + " witness job for batch " + l1BatchNumber);
    }
}
