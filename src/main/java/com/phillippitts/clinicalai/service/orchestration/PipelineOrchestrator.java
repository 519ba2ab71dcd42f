package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.ClinicalInput;
import com.phillippitts.clinicalai.domain.PipelineOptions;
import com.phillippitts.clinicalai.domain.PipelineResult;
import com.phillippitts.clinicalai.exception.PipelineException;

import java.time.Duration;

/**
 * Runs the clinical pipeline: safety screening, halt check, parallel assessments and
 * optional synthesis.
 *
 * <p>Step failures never propagate; they are recorded in the result's trace. Only a run that
 * cannot produce a result at all throws {@link PipelineException}.
 */
public interface PipelineOrchestrator {

    /**
     * Runs the pipeline on the calling thread without an overall deadline.
     *
     * @throws PipelineException if the input has no content
     * @throws NullPointerException if input or options is null
     */
    PipelineResult execute(ClinicalInput input, PipelineOptions options);

    /**
     * Runs the pipeline with an end-to-end deadline. When the deadline passes, the run is
     * interrupted, given a short grace period to stop its backend calls, and a degraded result
     * is returned with {@code timedOut=true} and HIGH risk. A run the pipeline executor cannot
     * accept returns the same degraded shape immediately.
     */
    PipelineResult run(ClinicalInput input, PipelineOptions options, Duration timeout);
}
