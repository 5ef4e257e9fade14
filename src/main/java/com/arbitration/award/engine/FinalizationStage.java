package com.arbitration.award.engine;

/**
 * One named step of award finalization. Stages are Spring beans; their {@code @Order} fixes the
 * execution order.
 */
public interface FinalizationStage {

    String name();

    StageFailurePolicy failurePolicy();

    /**
     * Run the stage, reading earlier results from and writing its own results to the context.
     */
    void execute(FinalizationContext context) throws Exception;
}
