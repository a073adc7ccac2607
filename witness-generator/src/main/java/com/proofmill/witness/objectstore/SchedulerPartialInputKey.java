package com.proofmill.witness.objectstore;

/** Location of the partial scheduler witness written for a batch by the basic-circuits round. */
public record SchedulerPartialInputKey(long l1BatchNumber) implements BlobKey {

    @Override
    public Bucket bucket() { return Bucket.SCHEDULER_WITNESS_JOBS; }

    @Override
    public String objectName() { return "scheduler_witness_" + l1BatchNumber + ".bin"; }
}
