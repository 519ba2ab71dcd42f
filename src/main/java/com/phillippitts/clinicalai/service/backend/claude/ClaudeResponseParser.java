package com.phillippitts.clinicalai.service.backend.claude;

import com.phillippitts.clinicalai.domain.TokenUsage;
import com.phillippitts.clinicalai.exception.GenerationExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses Messages API responses and server-sent stream events.
 */
final class ClaudeResponseParser {

    private ClaudeResponseParser() {}

    record Message(String text, String model, TokenUsage usage) {}

    static Message parseMessage(String json, String backendName) {
        JSONObject obj = parseObject(json, backendName);
        if ("error".equals(obj.optString("type"))) {
            throw errorFailure(obj, backendName);
        }
        JSONArray content = obj.optJSONArray("content");
        if (content == null) {
            throw GenerationExceptionBuilder.create("Response missing 'content' array").backend(backendName).build();
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            JSONObject block = content.optJSONObject(i);
            if (block != null && "text".equals(block.optString("type", "text"))) {
                text.append(block.optString("text", ""));
            }
        }
        return new Message(text.toString(), obj.optString("model", null), parseUsage(obj.optJSONObject("usage")));
    }

    static TokenUsage parseUsage(JSONObject usage) {
        if (usage == null) {
            return TokenUsage.NONE;
        }
        return new TokenUsage(
                Math.max(0, usage.optLong("input_tokens", 0)),
                Math.max(0, usage.optLong("output_tokens", 0)),
                Math.max(0, usage.optLong("cache_read_input_tokens", 0)),
                Math.max(0, usage.optLong("cache_creation_input_tokens", 0)));
    }

    /**
     * Accumulates one SSE stream. Feed it every {@code data:} payload in order.
     * Not thread-safe; one instance per stream.
     */
    static final class StreamState {
        private final String backendName;
        private final StringBuilder text = new StringBuilder();
        private String model;
        private long inputTokens;
        private long outputTokens;
        private long cacheReadTokens;
        private long cacheCreationTokens;
        private boolean stopped;
        private boolean started;

        StreamState(String backendName) {
            this.backendName = backendName;
        }

        /**
         * @return the text fragment carried by this event, or an empty string
         */
        String accept(String data) {
            JSONObject event = parseObject(data, backendName);
            switch (event.optString("type")) {
                case "message_start" -> {
                    started = true;
                    JSONObject message = event.optJSONObject("message");
                    if (message != null) {
                        model = message.optString("model", null);
                        TokenUsage usage = parseUsage(message.optJSONObject("usage"));
                        inputTokens = usage.inputTokens();
                        outputTokens = usage.outputTokens();
                        cacheReadTokens = usage.cacheReadTokens();
                        cacheCreationTokens = usage.cacheCreationTokens();
                    }
                    return "";
                }
                case "content_block_delta" -> {
                    JSONObject delta = event.optJSONObject("delta");
                    if (delta != null && "text_delta".equals(delta.optString("type"))) {
                        String fragment = delta.optString("text", "");
                        text.append(fragment);
                        return fragment;
                    }
                    return "";
                }
                case "message_delta" -> {
                    JSONObject usage = event.optJSONObject("usage");
                    if (usage != null) {
                        outputTokens = Math.max(outputTokens, usage.optLong("output_tokens", 0));
                    }
                    return "";
                }
                case "message_stop" -> {
                    stopped = true;
                    return "";
                }
                case "error" -> throw errorFailure(event, backendName);
                default -> {
                    return "";
                }
            }
        }

        boolean isStopped() {
            return stopped;
        }

        boolean isStarted() {
            return started;
        }

        String text() {
            return text.toString();
        }

        String model() {
            return model;
        }

        TokenUsage usage() {
            return new TokenUsage(inputTokens, outputTokens, cacheReadTokens, cacheCreationTokens);
        }
    }

    private static JSONObject parseObject(String json, String backendName) {
        if (json == null || json.isBlank()) {
            throw GenerationExceptionBuilder.create("Empty response body").backend(backendName).build();
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw GenerationExceptionBuilder.create("Malformed response body").backend(backendName).cause(e).build();
        }
    }

    private static RuntimeException errorFailure(JSONObject obj, String backendName) {
        JSONObject error = obj.optJSONObject("error");
        return GenerationExceptionBuilder.create("Backend reported error")
                .backend(backendName)
                .metadata("type", error == null ? null : error.optString("type", null))
                .metadata("error", error == null ? null : error.optString("message", null))
                .build();
    }
}
