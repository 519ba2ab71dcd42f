package com.phillippitts.clinicalai.service.backend;

import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.exception.BackendUnavailableException;
import com.phillippitts.clinicalai.exception.GenerationFailedException;

import java.util.function.Consumer;

/**
 * Contract for text-generation backends (local Ollama, metered Claude, or a composition of both).
 *
 * <p>A backend call is a single attempt: implementations never retry internally. Retry and
 * failover policy lives in {@link com.phillippitts.clinicalai.service.fallback.FallbackGenerationBackend}.
 *
 * <p>Thread Safety: Implementations must be thread-safe; the orchestrator issues concurrent
 * calls against the same instance.
 *
 * @see com.phillippitts.clinicalai.domain.GenerationResult
 * @see BackendUnavailableException
 * @see GenerationFailedException
 */
public interface GenerationBackend {

    /**
     * Generates text for the given request.
     *
     * @param request prompt, optional system text and options
     * @return generated text with usage accounting and timing
     * @throws BackendUnavailableException if the backend cannot be reached
     * @throws GenerationFailedException if the backend reports a failure
     * @throws NullPointerException if request is null
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * Generates text and delivers it incrementally to {@code onChunk}.
     *
     * <p>Default implementation generates the whole response and delivers it as one chunk.
     *
     * @return the aggregated result once the stream has finished
     */
    default GenerationResult generateStream(GenerationRequest request, Consumer<String> onChunk) {
        GenerationResult result = generate(request);
        if (!result.text().isEmpty()) {
            onChunk.accept(result.text());
        }
        return result;
    }

    /**
     * Cheap liveness check. Must not throw; transient errors are reported as {@code false}.
     */
    boolean isAvailable();

    /**
     * Snapshot for operational visibility. Not meant for control flow.
     */
    BackendStatus getStatus();

    /**
     * @return backend identifier used in results and traces (e.g. "ollama", "claude")
     */
    String getBackendName();

    /**
     * @return true when calls are billed and must pass budget admission control
     */
    default boolean isMetered() {
        return false;
    }
}
