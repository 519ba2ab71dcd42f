package com.phillippitts.clinicalai.service.backend.ollama;

import com.phillippitts.clinicalai.exception.GenerationExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Ollama {@code /api/generate} and {@code /api/tags} payloads.
 * Malformed generate bodies are reported as generation failures; malformed tag lists yield no models.
 */
final class OllamaResponseParser {

    private OllamaResponseParser() {}

    /**
     * One generate payload: either a complete non-streaming response or a single NDJSON stream line.
     *
     * @param text      generated text (the whole response, or this line's fragment)
     * @param model     model reported by the server, or null
     * @param promptTokens {@code prompt_eval_count}, 0 when absent
     * @param outputTokens {@code eval_count}, 0 when absent
     * @param done      true on the final stream line and on non-streaming responses
     */
    record Generation(String text, String model, long promptTokens, long outputTokens, boolean done) {}

    static Generation parseGenerate(String json, String backendName) {
        if (json == null || json.isBlank()) {
            throw GenerationExceptionBuilder.create("Empty response body").backend(backendName).build();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw GenerationExceptionBuilder.create("Malformed response body").backend(backendName).cause(e).build();
        }
        if (obj.has("error")) {
            throw GenerationExceptionBuilder.create("Backend reported error")
                    .backend(backendName)
                    .metadata("error", obj.optString("error"))
                    .build();
        }
        if (!obj.has("response")) {
            throw GenerationExceptionBuilder.create("Response missing 'response' field").backend(backendName).build();
        }
        return new Generation(
                obj.optString("response", ""),
                obj.has("model") ? obj.optString("model") : null,
                Math.max(0, obj.optLong("prompt_eval_count", 0)),
                Math.max(0, obj.optLong("eval_count", 0)),
                obj.optBoolean("done", true));
    }

    static List<String> parseModels(String json) {
        List<String> names = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return names;
        }
        try {
            JSONArray models = new JSONObject(json).optJSONArray("models");
            if (models == null) {
                return names;
            }
            for (int i = 0; i < models.length(); i++) {
                JSONObject model = models.optJSONObject(i);
                if (model != null && !model.optString("name", "").isBlank()) {
                    names.add(model.getString("name"));
                }
            }
        } catch (JSONException e) {
            return List.of();
        }
        return names;
    }
}
