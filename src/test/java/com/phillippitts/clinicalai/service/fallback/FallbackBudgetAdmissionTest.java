package com.phillippitts.clinicalai.service.fallback;

import com.phillippitts.clinicalai.config.properties.BudgetProperties;
import com.phillippitts.clinicalai.domain.GenerationOptions;
import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.TokenUsage;
import com.phillippitts.clinicalai.exception.BudgetExceededException;
import com.phillippitts.clinicalai.service.budget.CostCalculator;
import com.phillippitts.clinicalai.service.budget.InMemoryBudgetController;
import com.phillippitts.clinicalai.service.budget.UsageRecorder;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.testutil.FakeGenerationBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wrapper, controller and recorder wired together: each metered call costs exactly the ceiling.
 */
class FallbackBudgetAdmissionTest {

    private InMemoryBudgetController controller;
    private UsageRecorder recorder;
    private FakeGenerationBackend claude;
    private FakeGenerationBackend ollama;

    @BeforeEach
    void setUp() {
        BudgetProperties props = new BudgetProperties();
        props.setDailyCeilingUsd(0.0001);
        props.setInputPricePerMillion(1.0);
        props.setOutputPricePerMillion(0.0);
        controller = new InMemoryBudgetController(props,
                new CostCalculator(props.getInputPricePerMillion(), props.getOutputPricePerMillion()),
                Clock.systemUTC());
        recorder = new UsageRecorder(controller, 16);
        claude = FakeGenerationBackend.metered("claude");
        claude.usage = TokenUsage.of(100, 0);
        ollama = new FakeGenerationBackend("ollama");
    }

    @AfterEach
    void tearDown() {
        recorder.shutdown(Duration.ofSeconds(1));
    }

    private static GenerationRequest requestFor(String org) {
        return GenerationRequest.of("Assess", null, new GenerationOptions("clinical_summary", 200, 0.5, org));
    }

    private FallbackGenerationBackend compose(FakeGenerationBackend secondary) {
        return new FallbackGenerationBackend(claude, secondary, controller, recorder, null,
                PipelineMetricsPublisher.NOOP);
    }

    @Test
    void backToBackCallPastCeilingIsDenied() {
        FallbackGenerationBackend wrapper = compose(null);

        for (int i = 0; i < 50; i++) {
            String org = "clinic-" + i;
            wrapper.generate(requestFor(org));

            assertThatThrownBy(() -> wrapper.generate(requestFor(org)))
                    .isInstanceOf(BudgetExceededException.class);
        }
        assertThat(claude.callCount()).isEqualTo(50);
    }

    @Test
    void callPastCeilingGoesToLocalSecondary() {
        FallbackGenerationBackend wrapper = compose(ollama);

        assertThat(wrapper.generate(requestFor("clinic-1")).backendName()).isEqualTo("claude");
        assertThat(wrapper.generate(requestFor("clinic-1")).backendName()).isEqualTo("ollama");

        assertThat(claude.callCount()).isEqualTo(1);
        assertThat(controller.snapshot("clinic-1").spentMicros()).isEqualTo(100);
    }
}
