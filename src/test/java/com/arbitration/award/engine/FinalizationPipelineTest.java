package com.arbitration.award.engine;

import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.CaseStatus;
import com.arbitration.award.model.ReviewStatus;
import com.arbitration.award.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FinalizationPipelineTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsConfig metricsConfig = new MetricsConfig(registry);
    private final List<String> executed = new ArrayList<>();

    @Test
    void run_executesStagesInOrder() {
        FinalizationPipeline pipeline = pipeline(
                stage("first", StageFailurePolicy.ABORT, null),
                stage("second", StageFailurePolicy.CONTINUE, null),
                stage("third", StageFailurePolicy.ABORT, null));

        FinalizationContext result = pipeline.run(context());

        assertThat(executed).containsExactly("first", "second", "third");
        assertThat(result.getFailedStages()).isEmpty();
        assertThat(pipeline.stageNames()).containsExactly("first", "second", "third");
    }

    @Test
    void run_abortStageFailure_wrapsAndStops() {
        FinalizationPipeline pipeline = pipeline(
                stage("render", StageFailurePolicy.ABORT, new IllegalStateException("renderer down")),
                stage("after", StageFailurePolicy.CONTINUE, null));

        assertThatThrownBy(() -> pipeline.run(context()))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("render")
                .hasMessageContaining("renderer down")
                .satisfies(e -> assertThat(((ExternalServiceException) e).getService()).isEqualTo("render"))
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(executed).containsExactly("render");
        assertThat(registry.get("award.finalization.stage.failure.count").tag("stage", "render").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void run_abortStageTaxonomyError_propagatesUnchanged() {
        StateConflictException conflict = new StateConflictException("Award has already been issued for this case");
        FinalizationPipeline pipeline = pipeline(stage("persist", StageFailurePolicy.ABORT, conflict));

        assertThatThrownBy(() -> pipeline.run(context())).isSameAs(conflict);
    }

    @Test
    void run_continueStageFailure_recordsAndCarriesOn() {
        FinalizationPipeline pipeline = pipeline(
                stage("notify", StageFailurePolicy.CONTINUE, new RuntimeException("sms gateway")),
                stage("audit", StageFailurePolicy.CONTINUE, null));

        FinalizationContext result = pipeline.run(context());

        assertThat(executed).containsExactly("notify", "audit");
        assertThat(result.getFailedStages()).containsExactly("notify");
    }

    private FinalizationPipeline pipeline(FinalizationStage... stages) {
        return new FinalizationPipeline(List.of(stages), Tracer.NOOP, metricsConfig);
    }

    private FinalizationContext context() {
        return new FinalizationContext("case-1", "arb-1", "10.0.0.1", "junit",
                TestDataFactory.createDraft("case-1", ReviewStatus.APPROVE),
                TestDataFactory.createCase("case-1", CaseStatus.ARBITRATOR_REVIEW),
                null, System.currentTimeMillis());
    }

    private FinalizationStage stage(String name, StageFailurePolicy policy, RuntimeException failure) {
        return new FinalizationStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StageFailurePolicy failurePolicy() {
                return policy;
            }

            @Override
            public void execute(FinalizationContext context) {
                executed.add(name);
                if (failure != null) {
                    throw failure;
                }
            }
        };
    }
}
