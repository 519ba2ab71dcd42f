package com.phillippitts.clinicalai.service.backend;

import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.exception.ClinicalAiException;
import com.phillippitts.clinicalai.exception.GenerationExceptionBuilder;
import com.phillippitts.clinicalai.exception.GenerationFailedException;
import com.phillippitts.clinicalai.util.LogSanitizer;
import com.phillippitts.clinicalai.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Abstract base class for HTTP generation backends providing the call template, error
 * translation and failure/recovery bookkeeping.
 *
 * <p>This class implements the Template Method pattern. {@link #generate(GenerationRequest)}
 * validates the request, delegates to {@link #doGenerate(GenerationRequest, long)} and
 * converts any failure into the backend error taxonomy:
 * <ul>
 *   <li>connection refused, DNS failure, connect timeout: {@code BackendUnavailableException}</li>
 *   <li>request timeout, error status, malformed body: {@code GenerationFailedException}</li>
 * </ul>
 *
 * <p>Each failure publishes a {@link com.phillippitts.clinicalai.service.watchdog.BackendFailureEvent};
 * the first success after a failure publishes a
 * {@link com.phillippitts.clinicalai.service.watchdog.BackendRecoveredEvent}.
 *
 * <p><b>Thread Safety:</b> Stateless apart from atomic last-error bookkeeping; safe for
 * concurrent calls.
 *
 * @see com.phillippitts.clinicalai.service.backend.ollama.OllamaGenerationBackend
 * @see com.phillippitts.clinicalai.service.backend.claude.ClaudeGenerationBackend
 */
public abstract class AbstractGenerationBackend implements GenerationBackend {

    private static final Logger LOG = LogManager.getLogger(AbstractGenerationBackend.class);

    /** Maximum characters of an error body carried into exception messages. */
    protected static final int ERROR_BODY_PREVIEW_CHARS = 200;

    private final ApplicationEventPublisher publisher;
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicBoolean failing = new AtomicBoolean(false);

    protected AbstractGenerationBackend(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public final GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        long startNanos = System.nanoTime();
        try {
            GenerationResult result = doGenerate(request, startNanos);
            markSuccess();
            return result;
        } catch (Exception e) {
            throw handleGenerationError(e, TimeUtils.elapsedMillis(startNanos));
        }
    }

    @Override
    public final GenerationResult generateStream(GenerationRequest request, Consumer<String> onChunk) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(onChunk, "onChunk must not be null");
        long startNanos = System.nanoTime();
        try {
            GenerationResult result = doGenerateStream(request, onChunk, startNanos);
            markSuccess();
            return result;
        } catch (Exception e) {
            throw handleGenerationError(e, TimeUtils.elapsedMillis(startNanos));
        }
    }

    /**
     * Backend-specific single call.
     *
     * @param request    validated request
     * @param startNanos {@link System#nanoTime()} at call entry, for duration reporting
     */
    protected abstract GenerationResult doGenerate(GenerationRequest request, long startNanos)
            throws IOException, InterruptedException;

    /**
     * Backend-specific streaming call. Implementations deliver chunks in arrival order.
     */
    protected abstract GenerationResult doGenerateStream(GenerationRequest request,
                                                         Consumer<String> onChunk,
                                                         long startNanos)
            throws IOException, InterruptedException;

    /**
     * Backend-specific liveness check. May throw; {@link #isAvailable()} maps any failure to false.
     */
    protected abstract boolean checkAvailability() throws IOException, InterruptedException;

    /** Configured model identifier. */
    protected abstract String getModel();

    /** Installed models, for backends that can list them. */
    protected List<String> listModels() {
        return List.of();
    }

    @Override
    public final boolean isAvailable() {
        try {
            return checkAvailability();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.debug("Availability check failed for {}: {}", getBackendName(), e.toString());
            return false;
        }
    }

    @Override
    public BackendStatus getStatus() {
        boolean available = isAvailable();
        List<String> models = available ? safeListModels() : List.of();
        return new BackendStatus(getBackendName(), available, isMetered(), getModel(),
                lastError.get(), models, List.of());
    }

    /**
     * Converts a non-2xx response into {@link GenerationFailedException}, otherwise returns the body.
     */
    protected final String requireSuccess(HttpResponse<String> response, long startNanos) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        GenerationExceptionBuilder builder = GenerationExceptionBuilder
                .create(status == 429 ? "Rate limited by backend" : "Backend returned error status")
                .backend(getBackendName())
                .statusCode(status)
                .durationMs(TimeUtils.elapsedMillis(startNanos));
        String body = response.body();
        if (body != null && !body.isBlank()) {
            builder.metadata("error", LogSanitizer.preview(body, ERROR_BODY_PREVIEW_CHARS));
        }
        throw builder.build();
    }

    protected final ApplicationEventPublisher publisher() {
        return publisher;
    }

    /** Summary of the most recent failure, or null once the backend has succeeded again. */
    public final String lastError() {
        return lastError.get();
    }

    private List<String> safeListModels() {
        try {
            return listModels();
        } catch (RuntimeException e) {
            LOG.debug("Model listing failed for {}: {}", getBackendName(), e.toString());
            return List.of();
        }
    }

    private void markSuccess() {
        lastError.set(null);
        if (failing.compareAndSet(true, false)) {
            LOG.info("Backend {} recovered", getBackendName());
            BackendEventPublisher.publishRecovered(publisher, getBackendName());
        }
    }

    /**
     * Records the failure, publishes a failure event and maps the exception onto the backend
     * error taxonomy. Domain exceptions are rethrown without double-wrapping.
     */
    private ClinicalAiException handleGenerationError(Exception exception, long durationMs) {
        ClinicalAiException translated = translate(exception, durationMs);
        lastError.set(translated.getMessage());
        failing.set(true);
        LOG.warn("Backend {} call failed after {} ms: {}", getBackendName(), durationMs, translated.getMessage());
        BackendEventPublisher.publishFailure(publisher, getBackendName(), "generation failure", exception,
                Map.of("type", translated.getClass().getSimpleName(), "durationMs", String.valueOf(durationMs)));
        return translated;
    }

    private ClinicalAiException translate(Exception exception, long durationMs) {
        if (exception instanceof ClinicalAiException domain) {
            return domain;
        }
        String backend = getBackendName();
        if (exception instanceof HttpConnectTimeoutException || exception instanceof ConnectException) {
            return GenerationExceptionBuilder.create(backend + " is unreachable")
                    .backend(backend).cause(exception).durationMs(durationMs).buildUnavailable();
        }
        if (exception instanceof HttpTimeoutException) {
            return GenerationExceptionBuilder.create(backend + " request timed out")
                    .backend(backend).cause(exception).durationMs(durationMs).build();
        }
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return GenerationExceptionBuilder.create(backend + " request interrupted")
                    .backend(backend).cause(exception).durationMs(durationMs).build();
        }
        if (exception instanceof IOException || exception instanceof UnresolvedAddressException
                || exception.getCause() instanceof UnresolvedAddressException) {
            return GenerationExceptionBuilder.create(backend + " connection failed")
                    .backend(backend).cause(exception).durationMs(durationMs)
                    .metadata("reason", exception.getClass().getSimpleName())
                    .buildUnavailable();
        }
        return GenerationExceptionBuilder.create(backend + " generation failed: " + exception.getMessage())
                .backend(backend).cause(exception).durationMs(durationMs).build();
    }
}
