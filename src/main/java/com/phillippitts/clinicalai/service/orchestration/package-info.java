/**
 * Multi-step clinical inference pipeline.
 *
 * <p>A run screens for safety first, halts on critical risk, otherwise fans the enabled
 * assessments out in parallel and optionally synthesizes their outputs. Every step, successful
 * or not, lands in the execution trace of the returned
 * {@link com.phillippitts.clinicalai.domain.PipelineResult}.
 *
 * @since 1.0
 */
package com.phillippitts.clinicalai.service.orchestration;
