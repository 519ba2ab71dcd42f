/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.clinicalai.exception.ClinicalAiException} - Base exception
 *       for all pipeline errors</li>
 *   <li>{@link com.phillippitts.clinicalai.exception.BackendUnavailableException} - Backend
 *       could not be reached (transport/connectivity)</li>
 *   <li>{@link com.phillippitts.clinicalai.exception.GenerationFailedException} - Backend was
 *       reached but reported a failure (rate limit, bad status, malformed body, timeout)</li>
 *   <li>{@link com.phillippitts.clinicalai.exception.BudgetExceededException} - Admission
 *       control denied a metered call and no fallback was configured</li>
 *   <li>{@link com.phillippitts.clinicalai.exception.PipelineException} - A run could not
 *       produce any result; the only error surfaced by the orchestrator</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining. Backend exceptions carry
 * the backend name for diagnostics.
 *
 * @since 1.0
 */
package com.phillippitts.clinicalai.exception;
