package com.phillippitts.clinicalai.config.pipeline;

import com.phillippitts.clinicalai.service.budget.BudgetController;
import com.phillippitts.clinicalai.service.budget.UsageRecorder;
import com.phillippitts.clinicalai.service.fallback.FallbackGenerationBackend;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.testutil.FakeGenerationBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BackendTopologyFactoryTest {

    private final FakeGenerationBackend local = new FakeGenerationBackend("ollama");
    private final FakeGenerationBackend metered = FakeGenerationBackend.metered("claude");
    private final BackendTopologyFactory factory = new BackendTopologyFactory(local, metered,
            mock(BudgetController.class), mock(UsageRecorder.class), null, PipelineMetricsPublisher.NOOP);

    @ParameterizedTest
    @CsvSource({
            "LOCAL_ONLY, ollama",
            "LOCAL_WITH_METERED_FALLBACK, ollama+claude",
            "METERED_WITH_LOCAL_FALLBACK, claude+ollama",
            "METERED_ONLY, claude"
    })
    void resolvesCompositionName(BackendTopology topology, String expectedName) {
        assertThat(factory.create(topology).getBackendName()).isEqualTo(expectedName);
    }

    @Test
    void singleBackendTopologiesHaveNoSecondary() {
        FallbackGenerationBackend localOnly = factory.create(BackendTopology.LOCAL_ONLY);

        assertThat(localOnly.primary()).isSameAs(local);
        assertThat(localOnly.secondary()).isNull();
        assertThat(localOnly.isMetered()).isFalse();
    }

    @Test
    void meteredFirstTopologyOrdersBackends() {
        FallbackGenerationBackend composite = factory.create(BackendTopology.METERED_WITH_LOCAL_FALLBACK);

        assertThat(composite.primary()).isSameAs(metered);
        assertThat(composite.secondary()).isSameAs(local);
        assertThat(BackendTopology.METERED_WITH_LOCAL_FALLBACK.usesMetered()).isTrue();
        assertThat(BackendTopology.LOCAL_ONLY.usesMetered()).isFalse();
    }
}
