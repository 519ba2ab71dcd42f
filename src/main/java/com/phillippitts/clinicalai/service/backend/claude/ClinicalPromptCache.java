package com.phillippitts.clinicalai.service.backend.claude;

import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of static system prompt components, composed per task type into the system
 * blocks of a Claude request.
 *
 * <p>Components whose text reaches their minimum length are marked
 * {@code cache_control: {type: ephemeral}} so the provider can serve them from its prompt
 * cache. A per-request system prompt is appended as the last block and is only marked
 * cacheable when it exceeds {@value #CUSTOM_PROMPT_CACHE_THRESHOLD} characters. Task types
 * without a mapping get the clinical base prompt.
 *
 * <p>Thread-safe. Defaults are registered at construction; further registrations may
 * happen at any time.
 */
public class ClinicalPromptCache {

    public static final String CLINICAL_BASE = "clinical_base";
    static final int CUSTOM_PROMPT_CACHE_THRESHOLD = 500;
    private static final int DEFAULT_MIN_LENGTH = 100;
    private static final int CHARS_PER_TOKEN = 4;

    /**
     * A registered prompt fragment.
     *
     * @param minLength minimum text length before the component is marked cacheable
     */
    public record PromptComponent(String key, String text, String category, int priority, int minLength) {
        public PromptComponent {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(text, "text");
            category = category == null ? "clinical" : category;
        }

        boolean cacheable() {
            return text.length() >= minLength;
        }
    }

    /** One entry of the {@code system} array sent to the provider. */
    public record SystemBlock(String text, boolean cacheable) {
        public JSONObject toJson() {
            JSONObject block = new JSONObject().put("type", "text").put("text", text);
            if (cacheable) {
                block.put("cache_control", new JSONObject().put("type", "ephemeral"));
            }
            return block;
        }
    }

    /** Size summary of the registry, with a rough four-characters-per-token estimate. */
    public record CacheStats(int registeredKeys, int taskTypeMappings, long totalChars,
                             long cacheableChars, long estimatedCacheableTokens) {}

    private final Map<String, PromptComponent> registry = new ConcurrentHashMap<>();
    private final Map<String, List<String>> taskTypes = new ConcurrentHashMap<>();

    public ClinicalPromptCache() {
        registerDefaults();
        registerTaskMappings();
    }

    public void register(String key, String text, String category, int priority, int minLength) {
        registry.put(key, new PromptComponent(key, text, category, priority, minLength));
    }

    public void mapTaskType(String taskType, List<String> componentKeys) {
        taskTypes.put(taskType, List.copyOf(componentKeys));
    }

    public Optional<String> get(String key) {
        PromptComponent component = registry.get(key);
        return component == null ? Optional.empty() : Optional.of(component.text());
    }

    public boolean hasMapping(String taskType) {
        return taskTypes.containsKey(taskType);
    }

    /**
     * Builds the ordered system blocks for a task type.
     *
     * @param taskType           task-type tag from the request options
     * @param customSystemPrompt per-request system text (nullable), appended last
     * @return never empty while the clinical base prompt is registered
     */
    public List<SystemBlock> buildSystemBlocks(String taskType, String customSystemPrompt) {
        List<SystemBlock> blocks = new ArrayList<>();
        for (String key : taskTypes.getOrDefault(taskType, List.of())) {
            PromptComponent component = registry.get(key);
            if (component != null && !component.text().isEmpty()) {
                blocks.add(new SystemBlock(component.text(), component.cacheable()));
            }
        }
        if (blocks.isEmpty()) {
            get(CLINICAL_BASE).ifPresent(base -> blocks.add(new SystemBlock(base, true)));
        }
        if (customSystemPrompt != null && !customSystemPrompt.isBlank()) {
            blocks.add(new SystemBlock(customSystemPrompt,
                    customSystemPrompt.length() > CUSTOM_PROMPT_CACHE_THRESHOLD));
        }
        return Collections.unmodifiableList(blocks);
    }

    public CacheStats stats() {
        long total = 0;
        long cacheable = 0;
        for (PromptComponent component : registry.values()) {
            total += component.text().length();
            if (component.cacheable()) {
                cacheable += component.text().length();
            }
        }
        return new CacheStats(registry.size(), taskTypes.size(), total, cacheable,
                Math.round((double) cacheable / CHARS_PER_TOKEN));
    }

    private void registerDefaults() {
        register(CLINICAL_BASE,
                "You are a clinical assistant for musculoskeletal practitioners. Use correct medical "
                        + "terminology and follow national health-personnel regulations and professional guidelines.",
                "base", 1, 50);
        register("safety_context",
                "IMPORTANT: Always identify red flags that require immediate referral. Neurological deficits, "
                        + "cauda equina syndrome, fractures, infection and malignancy must always be flagged. "
                        + "When in doubt, recommend referral.",
                "base", 2, 50);
        register("red_flag_analysis",
                "You are a clinical safety assistant. Analyse the patient data and clinical findings for red flags.\n"
                        + "\n"
                        + "Red flags include:\n"
                        + "- Malignancy (weight loss, night pain, previous cancer)\n"
                        + "- Infection (fever, immunosuppression)\n"
                        + "- Cauda equina (bladder or bowel disturbance, saddle anaesthesia)\n"
                        + "- Fracture (significant trauma, osteoporosis)\n"
                        + "- Inflammatory conditions (morning stiffness, young age)\n"
                        + "\n"
                        + "Decide whether the patient can be treated safely or should be referred.",
                "clinical", 10, DEFAULT_MIN_LENGTH);
        register("red_flag_rules",
                "Answer with a JSON object {\"riskLevel\": \"LOW|MODERATE|HIGH|CRITICAL\", \"flags\": [\"...\"]} "
                        + "followed by a short justification. Use CRITICAL only when immediate referral is required.",
                "reference", 20, DEFAULT_MIN_LENGTH);
        register("clinical_summary",
                "You are a clinical assistant. Write a short, professional clinical summary suitable for "
                        + "the patient record or a referral letter.",
                "clinical", 10, DEFAULT_MIN_LENGTH);
        register("differential_guidelines",
                "List the most likely differential diagnoses in order of probability, each with the findings "
                        + "that support or weaken it. Name the tests that would discriminate between them.",
                "clinical", 10, DEFAULT_MIN_LENGTH);
        register("letter_base",
                "You write formal clinical correspondence. Use a professional tone, a clear structure with "
                        + "reason for referral, findings, assessment and request, and never invent findings.",
                "letter", 5, DEFAULT_MIN_LENGTH);
        register("synthesis",
                "Combine the supplied analyses into one coherent clinical picture. Resolve contradictions "
                        + "explicitly and keep every safety concern that any analysis raised.",
                "clinical", 10, DEFAULT_MIN_LENGTH);
    }

    private void registerTaskMappings() {
        mapTaskType("general", List.of(CLINICAL_BASE));
        mapTaskType("red_flags", List.of(CLINICAL_BASE, "safety_context", "red_flag_analysis", "red_flag_rules"));
        mapTaskType("clinical_summary", List.of(CLINICAL_BASE, "clinical_summary"));
        mapTaskType("differential_diagnosis", List.of(CLINICAL_BASE, "safety_context", "differential_guidelines"));
        mapTaskType("letter", List.of(CLINICAL_BASE, "letter_base"));
        mapTaskType("synthesis", List.of(CLINICAL_BASE, "safety_context", "synthesis"));
    }
}
