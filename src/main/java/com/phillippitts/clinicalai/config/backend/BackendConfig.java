package com.phillippitts.clinicalai.config.backend;

import com.phillippitts.clinicalai.config.pipeline.BackendTopologyFactory;
import com.phillippitts.clinicalai.config.properties.BackendProperties;
import com.phillippitts.clinicalai.config.properties.BudgetProperties;
import com.phillippitts.clinicalai.config.properties.WatchdogProperties;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.backend.claude.ClaudeGenerationBackend;
import com.phillippitts.clinicalai.service.backend.claude.ClinicalPromptCache;
import com.phillippitts.clinicalai.service.backend.ollama.OllamaGenerationBackend;
import com.phillippitts.clinicalai.service.budget.BudgetController;
import com.phillippitts.clinicalai.service.budget.CostCalculator;
import com.phillippitts.clinicalai.service.budget.InMemoryBudgetController;
import com.phillippitts.clinicalai.service.budget.UsageRecorder;
import com.phillippitts.clinicalai.service.health.GenerationBackendHealthIndicator;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.service.watchdog.BackendWatchdog;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;

/**
 * Wires the generation backends, budget accounting and the configured topology.
 *
 * <p>Three {@link GenerationBackend} beans exist: {@code ollamaBackend}, {@code claudeBackend}
 * and the {@link Primary} {@code pipelineBackend} composition resolved from
 * {@code clinical-ai.backend.topology}. Inject the leaves by qualifier.
 */
@Configuration
public class BackendConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OllamaGenerationBackend ollamaBackend(OllamaConfig config, ApplicationEventPublisher publisher) {
        return new OllamaGenerationBackend(config, publisher);
    }

    @Bean
    public ClinicalPromptCache clinicalPromptCache() {
        return new ClinicalPromptCache();
    }

    @Bean
    public ClaudeGenerationBackend claudeBackend(ClaudeConfig config, ClinicalPromptCache promptCache,
                                                 ApplicationEventPublisher publisher) {
        return new ClaudeGenerationBackend(config, promptCache, publisher);
    }

    @Bean
    public CostCalculator costCalculator(BudgetProperties props) {
        return new CostCalculator(props.getInputPricePerMillion(), props.getOutputPricePerMillion());
    }

    @Bean
    public BudgetController budgetController(BudgetProperties props, CostCalculator costCalculator, Clock clock) {
        return new InMemoryBudgetController(props, costCalculator, clock);
    }

    @Bean
    public UsageRecorder usageRecorder(BudgetController budgetController, BudgetProperties props) {
        return new UsageRecorder(budgetController, props.getQueueCapacity());
    }

    @Bean
    public MeterBinder usageRecorderMetrics(UsageRecorder recorder) {
        return registry -> {
            Gauge.builder("clinicalai.usage.submitted", recorder, UsageRecorder::submittedCount)
                    .description("Usage records submitted for accounting")
                    .register(registry);
            Gauge.builder("clinicalai.usage.recorded", recorder, UsageRecorder::recordedCount)
                    .description("Usage records written to the budget")
                    .register(registry);
            Gauge.builder("clinicalai.usage.dropped", recorder, UsageRecorder::droppedCount)
                    .description("Usage records dropped because the queue was full")
                    .register(registry);
            Gauge.builder("clinicalai.usage.failed", recorder, UsageRecorder::failedCount)
                    .description("Usage records that failed after retry")
                    .register(registry);
        };
    }

    @Bean
    @Primary
    public GenerationBackend pipelineBackend(BackendProperties backendProperties,
                                             @Qualifier("ollamaBackend") GenerationBackend local,
                                             @Qualifier("claudeBackend") GenerationBackend metered,
                                             BudgetController budgetController,
                                             UsageRecorder usageRecorder,
                                             ApplicationEventPublisher publisher,
                                             PipelineMetricsPublisher metrics) {
        return new BackendTopologyFactory(local, metered, budgetController, usageRecorder, publisher, metrics)
                .create(backendProperties.getTopology());
    }

    @Bean
    @ConditionalOnProperty(prefix = "clinical-ai.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BackendWatchdog backendWatchdog(@Qualifier("ollamaBackend") GenerationBackend local,
                                           @Qualifier("claudeBackend") GenerationBackend metered,
                                           WatchdogProperties props,
                                           ApplicationEventPublisher publisher,
                                           Clock clock) {
        return new BackendWatchdog(List.of(local, metered), props, publisher, clock);
    }

    @Bean
    public GenerationBackendHealthIndicator generationBackendHealthIndicator(GenerationBackend pipelineBackend,
                                                                             ObjectProvider<BackendWatchdog> watchdog) {
        return new GenerationBackendHealthIndicator(pipelineBackend, watchdog.getIfAvailable());
    }
}
