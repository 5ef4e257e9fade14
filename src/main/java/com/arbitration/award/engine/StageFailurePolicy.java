package com.arbitration.award.engine;

public enum StageFailurePolicy {
    /** Stop the pipeline and fail the whole finalization. */
    ABORT,
    /** Log, remember the failure on the context and carry on with the next stage. */
    CONTINUE
}
