package com.arbitration.award.engine;

import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.AwardServiceException;
import com.arbitration.award.exception.ExternalServiceException;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the finalization stages in order, each in its own span. A failing ABORT stage ends the run
 * and surfaces as an error; a failing CONTINUE stage is logged and recorded on the context.
 */
@Component
public class FinalizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(FinalizationPipeline.class);

    private final List<FinalizationStage> stages;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public FinalizationPipeline(List<FinalizationStage> stages, Tracer tracer, MetricsConfig metricsConfig) {
        this.stages = List.copyOf(stages);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (FinalizationStage stage : this.stages) {
            log.info("Registered finalization stage: {} ({})", stage.name(), stage.failurePolicy());
        }
    }

    public List<String> stageNames() {
        return stages.stream().map(FinalizationStage::name).toList();
    }

    @Observed(name = "award.finalize.pipeline", contextualName = "run-finalization-pipeline")
    public FinalizationContext run(FinalizationContext context) {
        for (FinalizationStage stage : stages) {
            Span span = tracer.nextSpan()
                    .name("finalize." + stage.name())
                    .tag("case.id", context.getCaseId())
                    .tag("stage.policy", stage.failurePolicy().name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                stage.execute(context);
                log.debug("Stage {} completed for case {}", stage.name(), context.getCaseId());
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordStageFailure(stage.name());

                if (stage.failurePolicy() == StageFailurePolicy.ABORT) {
                    log.error("Finalization of case {} aborted at stage {}: {}",
                            context.getCaseId(), stage.name(), e.getMessage(), e);
                    if (e instanceof AwardServiceException ase) {
                        throw ase;
                    }
                    throw new ExternalServiceException(stage.name(),
                            "Award finalization failed at " + stage.name() + ": " + e.getMessage(), e);
                }

                context.recordFailure(stage.name());
                log.warn("Stage {} failed for case {}, continuing: {}",
                        stage.name(), context.getCaseId(), e.getMessage());
            } finally {
                span.end();
            }
        }
        return context;
    }
}
