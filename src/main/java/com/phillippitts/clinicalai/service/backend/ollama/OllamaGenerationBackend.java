package com.phillippitts.clinicalai.service.backend.ollama;

import com.phillippitts.clinicalai.config.backend.OllamaConfig;
import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.domain.TokenUsage;
import com.phillippitts.clinicalai.exception.GenerationExceptionBuilder;
import com.phillippitts.clinicalai.service.backend.AbstractGenerationBackend;
import com.phillippitts.clinicalai.service.backend.BackendNames;
import com.phillippitts.clinicalai.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local, unmetered backend backed by an Ollama server.
 *
 * <p>Calls {@code POST /api/generate} with
 * {@code {model, prompt, system, stream, options:{temperature, num_predict}}}. Streaming
 * responses arrive as newline-delimited JSON, one fragment per line, with token counts on the
 * final {@code done} line. Availability and installed models come from {@code GET /api/tags}.
 */
public class OllamaGenerationBackend extends AbstractGenerationBackend {

    private static final Logger LOG = LogManager.getLogger(OllamaGenerationBackend.class);

    private final OllamaConfig config;
    private final HttpClient httpClient;

    public OllamaGenerationBackend(OllamaConfig config, ApplicationEventPublisher publisher) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
                .build(), publisher);
    }

    OllamaGenerationBackend(OllamaConfig config, HttpClient httpClient, ApplicationEventPublisher publisher) {
        super(publisher);
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        LOG.info("Ollama backend configured: baseUrl={}, model={}", config.baseUrl(), config.model());
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, long startNanos)
            throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(generateRequest(request, false),
                HttpResponse.BodyHandlers.ofString());
        String body = requireSuccess(response, startNanos);
        OllamaResponseParser.Generation generation = OllamaResponseParser.parseGenerate(body, getBackendName());
        return toResult(generation.text(), generation, startNanos);
    }

    @Override
    protected GenerationResult doGenerateStream(GenerationRequest request, Consumer<String> onChunk, long startNanos)
            throws IOException, InterruptedException {
        HttpResponse<Stream<String>> response = httpClient.send(generateRequest(request, true),
                HttpResponse.BodyHandlers.ofLines());
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw GenerationExceptionBuilder.create("Backend returned error status")
                        .backend(getBackendName())
                        .statusCode(response.statusCode())
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .metadata("error", lines.limit(5).collect(Collectors.joining(" ")))
                        .build();
            }
            StringBuilder text = new StringBuilder();
            OllamaResponseParser.Generation last = null;
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isBlank()) {
                    continue;
                }
                last = OllamaResponseParser.parseGenerate(line, getBackendName());
                if (!last.text().isEmpty()) {
                    text.append(last.text());
                    onChunk.accept(last.text());
                }
                if (last.done()) {
                    break;
                }
            }
            if (last == null) {
                throw GenerationExceptionBuilder.create("Stream ended without data").backend(getBackendName()).build();
            }
            return toResult(text.toString(), last, startNanos);
        }
    }

    @Override
    protected boolean checkAvailability() throws IOException, InterruptedException {
        return fetchTags().statusCode() == 200;
    }

    @Override
    protected List<String> listModels() {
        try {
            HttpResponse<String> response = fetchTags();
            return response.statusCode() == 200 ? OllamaResponseParser.parseModels(response.body()) : List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (IOException e) {
            LOG.debug("Could not list Ollama models: {}", e.toString());
            return List.of();
        }
    }

    @Override
    protected String getModel() {
        return config.model();
    }

    @Override
    public String getBackendName() {
        return BackendNames.OLLAMA;
    }

    private HttpResponse<String> fetchTags() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri("/api/tags"))
                .timeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest generateRequest(GenerationRequest request, boolean stream) {
        return HttpRequest.newBuilder(uri("/api/generate"))
                .timeout(Duration.ofSeconds(config.requestTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(request, stream).toString()))
                .build();
    }

    JSONObject buildBody(GenerationRequest request, boolean stream) {
        JSONObject body = new JSONObject()
                .put("model", config.model())
                .put("prompt", request.prompt())
                .put("stream", stream)
                .put("options", new JSONObject()
                        .put("temperature", request.options().temperature())
                        .put("num_predict", request.options().maxTokens()));
        request.system().ifPresent(system -> body.put("system", system));
        return body;
    }

    private GenerationResult toResult(String text, OllamaResponseParser.Generation generation, long startNanos) {
        String model = generation.model() != null ? generation.model() : config.model();
        return new GenerationResult(text, getBackendName(), model, TimeUtils.elapsedMillis(startNanos),
                TokenUsage.of(generation.promptTokens(), generation.outputTokens()));
    }

    private URI uri(String path) {
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        return URI.create(base + path);
    }
}
