package com.phillippitts.clinicalai.service.orchestration.event;

import com.phillippitts.clinicalai.domain.PipelineResult;

import java.time.Instant;

/**
 * Published once per pipeline run, including halted and timed-out runs.
 * Carries the full result; listeners must not log clinical text.
 */
public record PipelineCompletedEvent(PipelineResult result, String organizationId, Instant at) { }
