package com.phillippitts.clinicalai.config.pipeline;

import com.phillippitts.clinicalai.config.properties.PipelineProperties;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.service.orchestration.ClinicalPromptBuilder;
import com.phillippitts.clinicalai.service.orchestration.DefaultPipelineOrchestrator;
import com.phillippitts.clinicalai.service.orchestration.ParallelAssessmentService;
import com.phillippitts.clinicalai.service.orchestration.PipelineOrchestrator;
import com.phillippitts.clinicalai.service.orchestration.SafetyClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the orchestrator against the configured backend composition.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public ClinicalPromptBuilder clinicalPromptBuilder() {
        return new ClinicalPromptBuilder();
    }

    @Bean
    public SafetyClassifier safetyClassifier() {
        return new SafetyClassifier();
    }

    @Bean
    public ParallelAssessmentService parallelAssessmentService(
            GenerationBackend pipelineBackend,
            @Qualifier("assessmentExecutor") ThreadPoolTaskExecutor assessmentExecutor,
            PipelineMetricsPublisher metrics) {
        return new ParallelAssessmentService(pipelineBackend, assessmentExecutor, metrics);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(
            GenerationBackend pipelineBackend,
            ClinicalPromptBuilder promptBuilder,
            SafetyClassifier safetyClassifier,
            ParallelAssessmentService assessments,
            PipelineProperties properties,
            @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
            ApplicationEventPublisher publisher,
            PipelineMetricsPublisher metrics) {
        return new DefaultPipelineOrchestrator(pipelineBackend, promptBuilder, safetyClassifier, assessments,
                properties, pipelineExecutor, publisher, metrics);
    }
}
