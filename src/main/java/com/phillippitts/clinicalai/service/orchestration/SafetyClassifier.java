package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.RiskLevel;
import com.phillippitts.clinicalai.domain.SafetyAssessment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the raw text of a safety screening call into a {@link SafetyAssessment}.
 *
 * <p>A structured classification ({@code {"riskLevel": "...", "flags": [...]}}) anywhere in the
 * text wins. Otherwise the text is scanned for English and Norwegian keywords, highest tier
 * first: CRITICAL, then HIGH, then MODERATE, else LOW. Each tier matches its own name
 * ("Risk level: HIGH") as well as clinical terms. The matched keywords of the winning tier
 * become the flags.
 */
public class SafetyClassifier {

    private static final Logger LOG = LogManager.getLogger(SafetyClassifier.class);

    private static final Map<RiskLevel, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(RiskLevel.CRITICAL, List.of(
                "akutt henvisning", "øyeblikkelig", "cauda equina",
                "immediate referral", "urgent referral", "emergency"));
        KEYWORDS.put(RiskLevel.HIGH, List.of(
                "henvise", "lege", "utredning",
                "refer", "referral", "physician", "further investigation"));
        KEYWORDS.put(RiskLevel.MODERATE, List.of(
                "forsiktig", "overvåke",
                "caution", "monitor"));
    }

    /** Tier names set the level but never become flags. */
    private static final Map<RiskLevel, List<String>> TIER_NAMES = Map.of(
            RiskLevel.CRITICAL, List.of("critical", "kritisk"),
            RiskLevel.HIGH, List.of("high", "høy"),
            RiskLevel.MODERATE, List.of("moderate", "medium", "moderat"));

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        KEYWORDS.values().forEach(words -> words.forEach(SafetyClassifier::compile));
        TIER_NAMES.values().forEach(words -> words.forEach(SafetyClassifier::compile));
    }

    private static void compile(String word) {
        PATTERNS.put(word, Pattern.compile("(?<![\\p{L}])" + Pattern.quote(word) + "(?![\\p{L}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public SafetyAssessment classify(String rawText) {
        String text = rawText == null ? "" : rawText;
        Optional<SafetyAssessment> structured = parseStructured(text);
        if (structured.isPresent()) {
            return structured.get();
        }
        return scanKeywords(text);
    }

    Optional<SafetyAssessment> parseStructured(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = text.lastIndexOf('}');
            if (end <= start) {
                return Optional.empty();
            }
            Optional<SafetyAssessment> parsed = tryParse(text, start, end);
            if (parsed.isPresent()) {
                return parsed;
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private Optional<SafetyAssessment> tryParse(String text, int start, int end) {
        for (int close = end; close > start; close = text.lastIndexOf('}', close - 1)) {
            try {
                JSONObject obj = new JSONObject(text.substring(start, close + 1));
                Optional<RiskLevel> level = RiskLevel.parse(obj.optString("riskLevel", null));
                if (level.isEmpty()) {
                    return Optional.empty();
                }
                List<String> flags = new ArrayList<>();
                JSONArray array = obj.optJSONArray("flags");
                if (array != null) {
                    for (int i = 0; i < array.length(); i++) {
                        String flag = array.optString(i, "").trim();
                        if (!flag.isEmpty()) {
                            flags.add(flag);
                        }
                    }
                }
                return Optional.of(SafetyAssessment.of(level.get(), flags, text, SafetyAssessment.Source.STRUCTURED));
            } catch (JSONException e) {
                LOG.trace("Candidate is not a JSON object: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    SafetyAssessment scanKeywords(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<RiskLevel, List<String>> tier : KEYWORDS.entrySet()) {
            List<String> matched = new ArrayList<>();
            for (String keyword : tier.getValue()) {
                if (PATTERNS.get(keyword).matcher(lower).find()) {
                    matched.add(keyword);
                }
            }
            boolean named = TIER_NAMES.get(tier.getKey()).stream()
                    .anyMatch(name -> PATTERNS.get(name).matcher(lower).find());
            if (named || !matched.isEmpty()) {
                return SafetyAssessment.of(tier.getKey(), matched, text, SafetyAssessment.Source.KEYWORD);
            }
        }
        return SafetyAssessment.of(RiskLevel.LOW, List.of(), text, SafetyAssessment.Source.KEYWORD);
    }
}
