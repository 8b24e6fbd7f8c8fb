package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.AnalysisFailure;
import com.anxietycompanion.model.domain.AnalysisSource;
import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.RemoteAnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the Anthropic Messages API for a structured anxiety assessment.
 * Every problem is reported as a {@link RemoteAnalysisResult} failure; nothing is thrown.
 */
@Service
@Slf4j
public class ClaudeAnalysisClient {

    private static final int HISTORY_IN_PROMPT = 3;
    private static final int LOG_SNIPPET_LENGTH = 200;

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration timeout;

    public ClaudeAnalysisClient(WebClient anthropicClient,
                                ObjectMapper objectMapper,
                                @Value("${app.anthropic.api-key:}") String apiKey,
                                @Value("${app.anthropic.model:claude-3-5-haiku-20241022}") String model,
                                @Value("${app.anthropic.max-tokens:400}") int maxTokens,
                                @Value("${app.anthropic.temperature:0.7}") double temperature,
                                @Value("${app.anthropic.timeout-seconds:15}") long timeoutSeconds) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public RemoteAnalysisResult call(String text, List<String> recentHistory) {
        if (!StringUtils.hasText(apiKey)) {
            log.debug("Anthropic API key not configured, skipping remote analysis");
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_UNAVAILABLE, "API key not configured");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", List.of(Map.of("role", "user", "content", buildPrompt(text, recentHistory))));

        String raw;
        try {
            raw = anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 401) {
                log.warn("Anthropic API rejected credentials - check ANTHROPIC_API_KEY");
            } else if (e.getStatusCode().value() == 429) {
                log.warn("Anthropic API rate limit exceeded");
            } else {
                log.warn("Anthropic API error: HTTP {} - {}", e.getStatusCode().value(),
                        snippet(e.getResponseBodyAsString()));
            }
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_UNAVAILABLE,
                    "HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            log.warn("Anthropic API request failed: {}", e.getMessage());
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_UNAVAILABLE,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        return parse(raw);
    }

    RemoteAnalysisResult parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Empty response body");
        }

        String analysisText;
        try {
            JsonNode root = objectMapper.readTree(raw);
            analysisText = root.path("content").path(0).path("text").asText("");
        } catch (JsonProcessingException e) {
            log.warn("Anthropic response is not JSON: {}", snippet(raw));
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Response body is not JSON");
        }

        Optional<JsonNode> block = extractFirstJsonObject(analysisText);
        if (block.isEmpty()) {
            log.warn("No JSON block found in Claude response: {}", snippet(analysisText));
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "No structured block");
        }

        JsonNode node = block.get();
        JsonNode level = node.get("anxietyLevel");
        if (level == null || !level.isIntegralNumber()
                || level.asInt() < Assessment.MIN_LEVEL || level.asInt() > Assessment.MAX_LEVEL) {
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Invalid anxietyLevel");
        }
        Optional<List<String>> triggers = readStringArray(node.get("triggers"));
        if (triggers.isEmpty()) {
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Invalid triggers");
        }
        Optional<List<String>> coping = readStringArray(node.get("copingStrategies"));
        if (coping.isEmpty()) {
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Invalid copingStrategies");
        }
        JsonNode response = node.get("personalizedResponse");
        if (response == null || !response.isTextual()) {
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_MALFORMED, "Invalid personalizedResponse");
        }

        return RemoteAnalysisResult.success(Assessment.builder()
                .anxietyLevel(level.asInt())
                .triggers(triggers.get())
                .copingStrategies(coping.get())
                .personalizedResponse(response.asText().trim())
                .source(AnalysisSource.REMOTE)
                .build());
    }

    /**
     * Finds the first balanced {@code {...}} block in free text that parses as a JSON object.
     */
    Optional<JsonNode> extractFirstJsonObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findMatchingBrace(text, start);
            if (end < 0) {
                return Optional.empty();
            }
            try {
                JsonNode candidate = objectMapper.readTree(text.substring(start, end + 1));
                if (candidate != null && candidate.isObject()) {
                    return Optional.of(candidate);
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping unparseable block at offset {}", start);
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private int findMatchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<List<String>> readStringArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            return Optional.empty();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return Optional.empty();
            }
            values.add(item.asText());
        }
        return Optional.of(List.copyOf(values));
    }

    String buildPrompt(String text, List<String> recentHistory) {
        String lower = KeywordLexicon.normalize(text);
        boolean crisis = KeywordLexicon.hasCrisisSignal(lower) || KeywordLexicon.VIOLENT.matches(lower);
        boolean distressed = KeywordLexicon.SADNESS.matches(lower) || KeywordLexicon.ANXIETY.matches(lower)
                || KeywordLexicon.ANXIETY_INDICATORS.matches(lower);

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a trained crisis intervention companion. A user is reaching out with: \"")
                .append(text).append("\"\n\n");

        if (recentHistory != null && !recentHistory.isEmpty()) {
            List<String> tail = recentHistory.subList(
                    Math.max(0, recentHistory.size() - HISTORY_IN_PROMPT), recentHistory.size());
            prompt.append("Previous messages: ").append(String.join(" | ", tail)).append("\n\n");
        }
        if (crisis) {
            prompt.append("CRISIS ALERT: the user may be experiencing hallucinations, psychosis, self-harm "
                    + "thoughts or severe dissociation. This requires immediate grounding and safety "
                    + "intervention.\n");
        } else if (distressed) {
            prompt.append("The user appears to be in distress and needs immediate support.\n");
        }

        prompt.append("\nINSTRUCTIONS:\n");
        if (crisis) {
            prompt.append("- Be direct and brief (2-3 sentences max)\n")
                    .append("- Start with an immediate grounding action, not validation\n")
                    .append("- Give ONE clear instruction at a time\n")
                    .append("- End with the crisis number (988) if needed\n");
        } else if (KeywordLexicon.TRAUMA.matches(lower)) {
            prompt.append("- Trauma response: acknowledge the trauma without asking for details\n")
                    .append("- Provide a grounding technique for flashbacks\n")
                    .append("- Keep the response to 2-3 sentences with immediate relief focus\n");
        } else if (KeywordLexicon.OCD.matches(lower)) {
            prompt.append("- OCD response: do not provide reassurance that feeds the OCD cycle\n")
                    .append("- Suggest exposure and response prevention techniques\n")
                    .append("- Keep the response to 2-3 sentences\n");
        } else if (KeywordLexicon.PANIC.matches(lower)) {
            prompt.append("- Panic attack: give a breathing technique first\n")
                    .append("- Reassure that it will pass (10-20 minutes)\n")
                    .append("- Keep the response to 2-3 sentences\n");
        } else {
            prompt.append("- Keep the response to 2-3 sentences\n")
                    .append("- Be specific and action-oriented\n")
                    .append("- Give one clear action they can do now\n");
        }
        prompt.append("- Reply in the same language the user wrote in\n")
                .append("- Maximum 50 words for crisis, 75 for non-crisis\n\n")
                .append("Respond ONLY with valid JSON:\n")
                .append("{\n")
                .append("  \"anxietyLevel\": number from 1-10,\n")
                .append("  \"triggers\": [\"max 3 triggers\"],\n")
                .append("  \"copingStrategies\": [\"max 4 brief, actionable strategies\"],\n")
                .append("  \"personalizedResponse\": \"BRIEF 2-3 sentence response. Direct action first.\"\n")
                .append("}");
        return prompt.toString();
    }

    private String snippet(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > LOG_SNIPPET_LENGTH ? value.substring(0, LOG_SNIPPET_LENGTH) : value;
    }
}
