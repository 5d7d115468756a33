package io.memoryrunr.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.error.TransientIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Feature extraction and similarity scoring through a chat model. The model is asked for a single
 * JSON object; anything else is reported as a malformed response.
 *
 * <p>Transport failures are thrown as {@link TransientIoException} so that the resilience wrapper
 * can retry them and count them towards its circuit breaker.</p>
 */
public class RemoteEnrichmentProvider implements EnrichmentProvider {

    private static final Logger log = LoggerFactory.getLogger(RemoteEnrichmentProvider.class);

    static final String FEATURES_PROMPT = """
        Extract structured features from this memory: %s

        Return only JSON with these keys:
          "goal": one of Product Launch Strategy, Communication and Collaboration, Financial Planning and Management,
                  Project Management and Execution, Client Relations and Service, Operations and Maintenance,
                  General Task Processing
          "topics": array of short topic strings
          "entities": array of named entities
          "sentiment": number between -1 and 1
          "importance": number between 0 and 1
          "spatial_context": one of workplace, residential, unspecified
        """;

    static final String SIMILARITY_PROMPT = """
        Rate the semantic similarity of these two experiences.
        A: %s
        B: %s
        Return only JSON: {"similarity": number between 0 and 1}
        """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public RemoteEnrichmentProvider(ChatClient chatClient, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public EnrichmentResult<Features> enrich(EnrichmentRequest request) {
        String response = ask(FEATURES_PROMPT.formatted(request.text()));
        try {
            JsonNode root = objectMapper.readTree(extractJson(response));
            String goal = root.path("goal").asText(RuleBasedEnrichmentProvider.GENERAL_CATEGORY);
            return EnrichmentResult.ok(new Features(
                    goal.isBlank() ? RuleBasedEnrichmentProvider.GENERAL_CATEGORY : goal,
                    strings(root.path("topics")),
                    strings(root.path("entities")),
                    bounded(root.path("sentiment").asDouble(request.sentiment()), -1.0),
                    bounded(root.path("importance").asDouble(request.importance()), 0.0),
                    root.path("spatial_context").asText("unspecified")));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable enrichment response: {}", response);
            return EnrichmentResult.failed(EnrichmentError.malformed(e.getOriginalMessage()));
        }
    }

    @Override
    public EnrichmentResult<Double> similarity(String left, String right) {
        String response = ask(SIMILARITY_PROMPT.formatted(left, right));
        try {
            JsonNode similarity = objectMapper.readTree(extractJson(response)).path("similarity");
            if (!similarity.isNumber()) {
                return EnrichmentResult.failed(EnrichmentError.malformed("missing similarity"));
            }
            return EnrichmentResult.ok(bounded(similarity.asDouble(), 0.0));
        } catch (JsonProcessingException e) {
            return EnrichmentResult.failed(EnrichmentError.malformed(e.getOriginalMessage()));
        }
    }

    private String ask(String prompt) {
        try {
            String content = chatClient.prompt().user(prompt).call().content();
            if (content == null) {
                throw new TransientIoException("Chat model returned no content");
            }
            return content;
        } catch (TransientIoException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientIoException("Chat model call failed: " + e.getMessage(), e);
        }
    }

    /** Strips prose or code fences around the first JSON object. */
    static String extractJson(String response) {
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        return start >= 0 && end > start ? response.substring(start, end + 1) : response;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    private static double bounded(double value, double min) {
        return Math.max(min, Math.min(1.0, value));
    }
}
