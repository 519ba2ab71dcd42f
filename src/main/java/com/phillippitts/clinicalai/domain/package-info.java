/**
 * Immutable value types shared across the pipeline.
 *
 * <p>Requests and results flowing to and from generation backends
 * ({@link com.phillippitts.clinicalai.domain.GenerationRequest},
 * {@link com.phillippitts.clinicalai.domain.GenerationResult}), the safety assessment, the
 * execution trace and the root {@link com.phillippitts.clinicalai.domain.PipelineResult}.
 * All types are records validated in their compact constructors.
 *
 * @since 1.0
 */
package com.phillippitts.clinicalai.domain;
