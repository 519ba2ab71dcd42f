package com.phillippitts.clinicalai.service.backend.claude;

import com.phillippitts.clinicalai.config.backend.ClaudeConfig;
import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.exception.GenerationExceptionBuilder;
import com.phillippitts.clinicalai.service.backend.AbstractGenerationBackend;
import com.phillippitts.clinicalai.service.backend.BackendNames;
import com.phillippitts.clinicalai.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Metered backend calling the Anthropic Messages API.
 *
 * <p>System text is sent as an array of blocks built by {@link ClinicalPromptCache}; static
 * clinical components carry {@code cache_control} markers when prompt caching is enabled.
 * Usage, including cache reads and writes, is returned on every result so the caller can
 * account for spend.
 *
 * <p>Without an API key the backend reports itself unavailable and every call fails with
 * {@code BackendUnavailableException}.
 */
public class ClaudeGenerationBackend extends AbstractGenerationBackend {

    private static final Logger LOG = LogManager.getLogger(ClaudeGenerationBackend.class);
    private static final String SSE_DATA_PREFIX = "data:";

    private final ClaudeConfig config;
    private final ClinicalPromptCache promptCache;
    private final HttpClient httpClient;

    public ClaudeGenerationBackend(ClaudeConfig config, ClinicalPromptCache promptCache,
                                   ApplicationEventPublisher publisher) {
        this(config, promptCache, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
                .build(), publisher);
    }

    ClaudeGenerationBackend(ClaudeConfig config, ClinicalPromptCache promptCache, HttpClient httpClient,
                            ApplicationEventPublisher publisher) {
        super(publisher);
        this.config = Objects.requireNonNull(config, "config");
        this.promptCache = Objects.requireNonNull(promptCache, "promptCache");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (config.hasApiKey()) {
            ClinicalPromptCache.CacheStats stats = promptCache.stats();
            LOG.info("Claude backend configured: model={}, promptCaching={}, cacheableTokens~{}",
                    config.model(), config.promptCachingEnabled(), stats.estimatedCacheableTokens());
        } else {
            LOG.warn("Claude backend has no API key configured; it will report unavailable");
        }
    }

    @Override
    public boolean isMetered() {
        return true;
    }

    @Override
    public String getBackendName() {
        return BackendNames.CLAUDE;
    }

    @Override
    protected String getModel() {
        return config.model();
    }

    @Override
    protected boolean checkAvailability() {
        return config.hasApiKey();
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, long startNanos)
            throws IOException, InterruptedException {
        requireApiKey();
        HttpResponse<String> response = httpClient.send(messagesRequest(request, false),
                HttpResponse.BodyHandlers.ofString());
        String body = requireSuccess(response, startNanos);
        ClaudeResponseParser.Message message = ClaudeResponseParser.parseMessage(body, getBackendName());
        LOG.debug("Claude usage: input={}, output={}, cacheRead={}, cacheWrite={}",
                message.usage().inputTokens(), message.usage().outputTokens(),
                message.usage().cacheReadTokens(), message.usage().cacheCreationTokens());
        return new GenerationResult(message.text(), getBackendName(),
                message.model() != null ? message.model() : config.model(),
                TimeUtils.elapsedMillis(startNanos), message.usage());
    }

    @Override
    protected GenerationResult doGenerateStream(GenerationRequest request, Consumer<String> onChunk, long startNanos)
            throws IOException, InterruptedException {
        requireApiKey();
        HttpResponse<Stream<String>> response = httpClient.send(messagesRequest(request, true),
                HttpResponse.BodyHandlers.ofLines());
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw GenerationExceptionBuilder
                        .create(response.statusCode() == 429 ? "Rate limited by backend" : "Backend returned error status")
                        .backend(getBackendName())
                        .statusCode(response.statusCode())
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .metadata("error", lines.limit(5).collect(Collectors.joining(" ")))
                        .build();
            }
            ClaudeResponseParser.StreamState state = new ClaudeResponseParser.StreamState(getBackendName());
            Iterator<String> it = lines.iterator();
            while (it.hasNext() && !state.isStopped()) {
                String line = it.next();
                if (!line.startsWith(SSE_DATA_PREFIX)) {
                    continue;
                }
                String fragment = state.accept(line.substring(SSE_DATA_PREFIX.length()).trim());
                if (!fragment.isEmpty()) {
                    onChunk.accept(fragment);
                }
            }
            if (!state.isStarted()) {
                throw GenerationExceptionBuilder.create("Stream ended without data").backend(getBackendName()).build();
            }
            return new GenerationResult(state.text(), getBackendName(),
                    state.model() != null ? state.model() : config.model(),
                    TimeUtils.elapsedMillis(startNanos), state.usage());
        }
    }

    JSONObject buildBody(GenerationRequest request, boolean stream) {
        JSONObject body = new JSONObject()
                .put("model", config.model())
                .put("max_tokens", request.options().maxTokens())
                .put("temperature", request.options().temperature())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", request.prompt())));
        JSONArray system = systemBlocks(request);
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private JSONArray systemBlocks(GenerationRequest request) {
        JSONArray blocks = new JSONArray();
        if (!config.promptCachingEnabled()) {
            request.system().ifPresent(text ->
                    blocks.put(new ClinicalPromptCache.SystemBlock(text, false).toJson()));
            return blocks;
        }
        for (ClinicalPromptCache.SystemBlock block
                : promptCache.buildSystemBlocks(request.options().taskType(), request.systemPrompt())) {
            blocks.put(block.toJson());
        }
        return blocks;
    }

    private HttpRequest messagesRequest(GenerationRequest request, boolean stream) {
        return HttpRequest.newBuilder(uri("/v1/messages"))
                .timeout(Duration.ofSeconds(config.requestTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .header("x-api-key", config.apiKey())
                .header("anthropic-version", config.apiVersion())
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(request, stream).toString()))
                .build();
    }

    private void requireApiKey() {
        if (!config.hasApiKey()) {
            throw GenerationExceptionBuilder.create("API key not configured")
                    .backend(getBackendName())
                    .buildUnavailable();
        }
    }

    private URI uri(String path) {
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        return URI.create(base + path);
    }
}
