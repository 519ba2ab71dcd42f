package com.phillippitts.clinicalai.config.pipeline;

import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.budget.BudgetController;
import com.phillippitts.clinicalai.service.budget.UsageRecorder;
import com.phillippitts.clinicalai.service.fallback.FallbackGenerationBackend;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Resolves a {@link BackendTopology} once into the backend capability the pipeline uses.
 *
 * <p>Every topology yields a {@link FallbackGenerationBackend}; single-backend topologies have
 * no secondary but still get budget admission when metered.
 */
public class BackendTopologyFactory {

    private static final Logger LOG = LogManager.getLogger(BackendTopologyFactory.class);

    private final GenerationBackend local;
    private final GenerationBackend metered;
    private final BudgetController budgetController;
    private final UsageRecorder usageRecorder;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metrics;

    public BackendTopologyFactory(GenerationBackend local,
                                  GenerationBackend metered,
                                  BudgetController budgetController,
                                  UsageRecorder usageRecorder,
                                  ApplicationEventPublisher publisher,
                                  PipelineMetricsPublisher metrics) {
        this.local = Objects.requireNonNull(local, "local");
        this.metered = Objects.requireNonNull(metered, "metered");
        this.budgetController = budgetController;
        this.usageRecorder = usageRecorder;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    public FallbackGenerationBackend create(BackendTopology topology) {
        Objects.requireNonNull(topology, "topology");
        GenerationBackend primary = select(topology.primary());
        GenerationBackend secondary = topology.secondary() == null ? null : select(topology.secondary());
        FallbackGenerationBackend backend = new FallbackGenerationBackend(primary, secondary,
                budgetController, usageRecorder, publisher, metrics);
        LOG.info("Backend topology {} resolved to {}", topology, backend.getBackendName());
        return backend;
    }

    private GenerationBackend select(BackendTopology.Tier tier) {
        return tier == BackendTopology.Tier.LOCAL ? local : metered;
    }
}
