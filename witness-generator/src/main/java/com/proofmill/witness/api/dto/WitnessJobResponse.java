package com.proofmill.witness.api.dto;

import com.proofmill.witness.model.AggregationRound;
import com.proofmill.witness.model.FailureKind;
import com.proofmill.witness.model.WitnessJob;
import com.proofmill.witness.model.WitnessJobStatus;

import java.time.Instant;

/**
 * Response body for GET /witness-jobs/{round}/{l1BatchNumber}.
 */
public record WitnessJobResponse(
        long             l1BatchNumber,
        AggregationRound round,
        WitnessJobStatus status,
        int              attempts,
        String           pickedBy,
        FailureKind      errorKind,
        String           errorMessage,
        Long             timeTakenMs,
        Instant          createdAt,
        Instant          updatedAt
) {
    public static WitnessJobResponse from(WitnessJob job) {
        return new WitnessJobResponse(
                job.getL1BatchNumber(),
                job.getRound(),
                job.getStatus(),
                job.getAttempts(),
                job.getPickedBy(),
                job.getErrorKind(),
                job.getErrorMessage(),
                job.getTimeTakenMs(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
