package io.memoryrunr.consolidation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps an episode's goal category onto the cortical region its long-term memory is filed under.
 * Known goal names map directly; anything else is matched on keywords, then defaults to
 * {@value #GENERAL}.
 */
public final class CorticalCategories {

    public static final String GENERAL = "general_cognition";

    private static final Map<String, String> BY_GOAL = Map.of(
            "Product Launch Strategy", "executive_function",
            "Communication and Collaboration", "social_cognition",
            "Financial Planning and Management", "quantitative_reasoning",
            "Project Management and Execution", "temporal_sequencing",
            "Client Relations and Service", "interpersonal_skills",
            "Operations and Maintenance", "technical_procedures");

    private static final Map<String, String> BY_KEYWORD = new LinkedHashMap<>();

    static {
        BY_KEYWORD.put("strategy", "executive_function");
        BY_KEYWORD.put("communication", "social_cognition");
        BY_KEYWORD.put("financial", "quantitative_reasoning");
        BY_KEYWORD.put("project", "temporal_sequencing");
        BY_KEYWORD.put("client", "interpersonal_skills");
        BY_KEYWORD.put("operations", "technical_procedures");
    }

    private CorticalCategories() {
    }

    public static String of(String goalCategory) {
        if (goalCategory == null) {
            return GENERAL;
        }
        String direct = BY_GOAL.get(goalCategory);
        if (direct != null) {
            return direct;
        }
        String lower = goalCategory.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : BY_KEYWORD.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return GENERAL;
    }
}
