/**
 * Generation backend abstraction and its HTTP implementations.
 *
 * <p>{@link com.phillippitts.clinicalai.service.backend.GenerationBackend} is the single seam the
 * pipeline calls through. Leaf backends extend
 * {@link com.phillippitts.clinicalai.service.backend.AbstractGenerationBackend}, which owns error
 * translation and failure/recovery event publication:
 * <ul>
 *   <li>{@code ollama}: local, unmetered inference server</li>
 *   <li>{@code claude}: hosted, metered messages API with prompt caching</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.clinicalai.service.backend;
