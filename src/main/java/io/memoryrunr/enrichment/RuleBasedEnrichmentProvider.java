package io.memoryrunr.enrichment;

import java.util.*;

/**
 * Local keyword rules. Always available, so it is the fallback behind every remote provider.
 *
 * <p>Goal categories are matched in order; the first rule with a keyword in the content wins.</p>
 */
public class RuleBasedEnrichmentProvider implements EnrichmentProvider {

    public static final String GENERAL_CATEGORY = "General Task Processing";

    private static final List<Rule> GOAL_RULES = List.of(
            new Rule("Product Launch Strategy", "launch", "strategy"),
            new Rule("Communication and Collaboration", "presentation", "meeting"),
            new Rule("Financial Planning and Management", "budget", "financial"),
            new Rule("Project Management and Execution", "project", "deadline"),
            new Rule("Client Relations and Service", "client", "customer"),
            new Rule("Operations and Maintenance", "maintenance", "fix")
    );

    // Importance boosts, strongest first
    private static final List<Boost> IMPORTANCE_BOOSTS = List.of(
            new Boost(0.3, "important", "critical", "urgent"),
            new Boost(0.25, "success", "achievement", "completed"),
            new Boost(0.2, "problem", "issue", "broken"),
            new Boost(0.15, "deadline", "due", "pending")
    );

    private static final Set<String> TOPIC_VOCABULARY = Set.of(
            "launch", "strategy", "presentation", "meeting", "budget", "financial", "project", "deadline",
            "client", "customer", "maintenance", "fix", "review", "analysis", "schedule", "appointment",
            "report", "document", "slides", "planning", "release", "hiring", "deployment", "incident");

    private static final Set<String> POSITIVE = Set.of("success", "achievement", "completed", "great", "happy", "win");
    private static final Set<String> NEGATIVE = Set.of("problem", "issue", "broken", "failed", "late", "angry");

    @Override
    public String name() {
        return "rule-based";
    }

    @Override
    public EnrichmentResult<Features> enrich(EnrichmentRequest request) {
        String text = request.text() == null ? "" : request.text();
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> words = tokens(lower);

        return EnrichmentResult.ok(new Features(
                goalCategory(lower),
                topics(words),
                entities(text),
                sentiment(words, request.sentiment()),
                importance(lower, request.importance()),
                spatialContext(lower)));
    }

    @Override
    public EnrichmentResult<Double> similarity(String left, String right) {
        Set<String> a = new HashSet<>(tokens(left.toLowerCase(Locale.ROOT)));
        Set<String> b = new HashSet<>(tokens(right.toLowerCase(Locale.ROOT)));
        if (a.isEmpty() && b.isEmpty()) {
            return EnrichmentResult.ok(0.0);
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        a.retainAll(b);
        return EnrichmentResult.ok((double) a.size() / union.size());
    }

    static String goalCategory(String lowerText) {
        for (Rule rule : GOAL_RULES) {
            for (String keyword : rule.keywords()) {
                if (lowerText.contains(keyword)) {
                    return rule.category();
                }
            }
        }
        return GENERAL_CATEGORY;
    }

    private static List<String> topics(List<String> words) {
        return words.stream().filter(TOPIC_VOCABULARY::contains).distinct().toList();
    }

    private static List<String> entities(String text) {
        List<String> entities = new ArrayList<>();
        String[] raw = text.split("\\s+");
        for (int i = 1; i < raw.length; i++) {
            String word = raw[i].replaceAll("[^\\p{L}\\p{N}]", "");
            boolean sentenceStart = raw[i - 1].endsWith(".") || raw[i - 1].endsWith("!") || raw[i - 1].endsWith("?");
            if (!sentenceStart && word.length() > 1 && Character.isUpperCase(word.charAt(0)) && !entities.contains(word)) {
                entities.add(word);
            }
        }
        return entities;
    }

    private static double sentiment(List<String> words, double supplied) {
        if (supplied != 0.0) {
            return supplied;
        }
        long positive = words.stream().filter(POSITIVE::contains).count();
        long negative = words.stream().filter(NEGATIVE::contains).count();
        if (positive + negative == 0) {
            return 0.0;
        }
        return (double) (positive - negative) / (positive + negative);
    }

    private static double importance(String lowerText, double supplied) {
        for (Boost boost : IMPORTANCE_BOOSTS) {
            for (String keyword : boost.keywords()) {
                if (lowerText.contains(keyword)) {
                    return Math.min(1.0, supplied + boost.amount());
                }
            }
        }
        return supplied;
    }

    private static String spatialContext(String lowerText) {
        if (lowerText.contains("office") || lowerText.contains("meeting room")) {
            return "workplace";
        }
        if (lowerText.contains("home") || lowerText.contains("remote")) {
            return "residential";
        }
        return "unspecified";
    }

    private static List<String> tokens(String lowerText) {
        List<String> tokens = new ArrayList<>();
        for (String token : lowerText.split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 3) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private record Rule(String category, String... keywords) {
    }

    private record Boost(double amount, String... keywords) {
    }
}
