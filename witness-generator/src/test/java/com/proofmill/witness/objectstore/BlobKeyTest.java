package com.proofmill.witness.objectstore;

import com.proofmill.witness.model.AggregationRound;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Object names are persisted and read by other services, so their format is pinned here.
 */
class BlobKeyTest {

    @Test
    void circuitKey_sameFields_sameObjectName() {
        CircuitKey a = new CircuitKey(42, 1, 0, 0, AggregationRound.SCHEDULER);
        CircuitKey b = new CircuitKey(42, 1, 0, 0, AggregationRound.SCHEDULER);

        assertThat(a).isEqualTo(b);
        assertThat(a.objectName()).isEqualTo(b.objectName());
    }

    @Test
    void circuitKey_objectNameFormat() {
        CircuitKey key = new CircuitKey(42, 1, 0, 0, AggregationRound.SCHEDULER);

        assertThat(key.bucket()).isEqualTo(Bucket.PROVER_JOBS);
        assertThat(key.objectName()).isEqualTo("42_0_1_SCHEDULER_0.bin");
    }

    @Test
    void circuitKey_everyFieldChangesTheName() {
        String base = new CircuitKey(7, 3, 2, 1, AggregationRound.NODE_AGGREGATION).objectName();

        assertThat(new CircuitKey(8, 3, 2, 1, AggregationRound.NODE_AGGREGATION).objectName()).isNotEqualTo(base);
        assertThat(new CircuitKey(7, 4, 2, 1, AggregationRound.NODE_AGGREGATION).objectName()).isNotEqualTo(base);
        assertThat(new CircuitKey(7, 3, 5, 1, AggregationRound.NODE_AGGREGATION).objectName()).isNotEqualTo(base);
        assertThat(new CircuitKey(7, 3, 2, 0, AggregationRound.NODE_AGGREGATION).objectName()).isNotEqualTo(base);
        assertThat(new CircuitKey(7, 3, 2, 1, AggregationRound.LEAF_AGGREGATION).objectName()).isNotEqualTo(base);
    }

    @Test
    void circuitKey_withoutRound_rejected() {
        assertThatThrownBy(() -> new CircuitKey(1, 1, 0, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void proofAndPartialInputKeys() {
        assertThat(new ProofKey(17).objectName()).isEqualTo("proof_17.bin");
        assertThat(new ProofKey(17).bucket()).isEqualTo(Bucket.PROOFS);
        assertThat(new SchedulerPartialInputKey(42).objectName()).isEqualTo("scheduler_witness_42.bin");
        assertThat(new SchedulerPartialInputKey(42).bucket()).isEqualTo(Bucket.SCHEDULER_WITNESS_JOBS);
    }
}
