package com.phillippitts.clinicalai.service.metrics;

import com.phillippitts.clinicalai.domain.PipelineResult;
import com.phillippitts.clinicalai.domain.PipelineStep;
import com.phillippitts.clinicalai.domain.RiskLevel;
import com.phillippitts.clinicalai.domain.SafetyAssessment;
import com.phillippitts.clinicalai.domain.StepName;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new PipelineMetricsPublisher(new PipelineMetrics(registry));
    }

    @Test
    void completedStepRecordsLatencyAndSuccess() {
        publisher.recordStep(PipelineStep.completed(StepName.CLINICAL, "ollama", 120));

        assertThat(registry.get("clinicalai.pipeline.step.latency").tag("step", "clinical").tag("backend", "ollama")
                .timer().count()).isEqualTo(1);
        assertThat(registry.get("clinicalai.pipeline.step.success").tag("step", "clinical")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedStepIsTaggedByErrorType() {
        publisher.recordStep(PipelineStep.failed(StepName.LETTER, "GenerationFailedException: boom", 5));

        assertThat(registry.get("clinicalai.pipeline.step.failure")
                .tag("step", "letter").tag("reason", "GenerationFailedException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void runOutcomeIsTagged() {
        SafetyAssessment critical = SafetyAssessment.of(RiskLevel.CRITICAL, List.of("x"), "",
                SafetyAssessment.Source.STRUCTURED);
        publisher.recordRun(new PipelineResult("p", true, "halted", critical, Map.of(), null, List.of(), 10, false));

        assertThat(registry.get("clinicalai.pipeline.run").tag("outcome", "halted").timer().count()).isEqualTo(1);
    }

    @Test
    void fallbackAndBudgetCounters() {
        publisher.recordFallback("ollama", "claude");
        publisher.recordBudgetDenial("CEILING_EXCEEDED");

        assertThat(registry.get("clinicalai.pipeline.fallback").tag("from", "ollama").tag("to", "claude")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("clinicalai.pipeline.budget.denied").tag("reason", "CEILING_EXCEEDED")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopPublisherIgnoresEverything() {
        PipelineMetricsPublisher.NOOP.recordStep(PipelineStep.completed(StepName.SAFETY, "ollama", 1));
        PipelineMetricsPublisher.NOOP.recordFallback("a", "b");

        assertThat(PipelineMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();
    }

    @Test
    void categorizeUsesTypePrefix() {
        assertThat(PipelineMetricsPublisher.categorize("BackendUnavailableException: refused"))
                .isEqualTo("BackendUnavailableException");
        assertThat(PipelineMetricsPublisher.categorize("no colon")).isEqualTo("error");
        assertThat(PipelineMetricsPublisher.categorize(null)).isEqualTo("unknown");
    }
}
