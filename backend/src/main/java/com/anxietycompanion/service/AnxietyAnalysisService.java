package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.AnalysisFailure;
import com.anxietycompanion.model.domain.AnalysisSource;
import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.CrisisRisk;
import com.anxietycompanion.model.domain.RemoteAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Produces one assessment per message: the remote model when it gives a usable
 * answer, the local classifier otherwise. Never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnxietyAnalysisService {

    static final int MIN_RESPONSE_LENGTH = 10;

    // Placeholder answers the remote side returns when it has nothing specific to say.
    static final Set<String> GENERIC_RESPONSES = Set.of(
            "I'm here to support you through this.",
            "I'm here to support you through this difficult time. Let's work together to help you feel better.",
            "I'm here to support you through this difficult time. Let's focus on some coping strategies that "
                    + "can help you feel better.");

    private final ClaudeAnalysisClient claudeAnalysisClient;
    private final HeuristicAnxietyClassifier heuristicClassifier;

    public Assessment analyze(String text, List<String> recentHistory) {
        List<String> history = recentHistory != null ? recentHistory : List.of();

        RemoteAnalysisResult result = callRemote(text, history);
        if (result.isSuccess()) {
            Assessment remote = result.getAssessment();
            if (isGeneric(remote.getPersonalizedResponse())) {
                result = RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_GENERIC, "Generic response");
            } else {
                Assessment tagged = tagRemote(remote, text);
                log.info("Analysis from {}: level={}, risk={}", AnalysisSource.REMOTE.getCode(),
                        tagged.getAnxietyLevel(), tagged.getCrisisRisk().getCode());
                return tagged;
            }
        }

        log.info("Remote analysis failed ({}: {}), using local fallback", result.getFailure(), result.getDetail());
        Assessment fallback = heuristicClassifier.classify(text, history);
        log.info("Analysis from {}: category={}, level={}, risk={}", AnalysisSource.FALLBACK.getCode(),
                fallback.getCategory(), fallback.getAnxietyLevel(), fallback.getCrisisRisk().getCode());
        return fallback;
    }

    private RemoteAnalysisResult callRemote(String text, List<String> history) {
        try {
            return claudeAnalysisClient.call(text, history);
        } catch (RuntimeException e) {
            log.warn("Remote analysis threw unexpectedly", e);
            return RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_UNAVAILABLE, e.getClass().getSimpleName());
        }
    }

    private Assessment tagRemote(Assessment remote, String text) {
        String normalized = KeywordLexicon.normalize(text);
        return remote.toBuilder()
                .source(AnalysisSource.REMOTE)
                .crisisRisk(CrisisRisk.derive(remote.getAnxietyLevel(), KeywordLexicon.hasCrisisSignal(normalized)))
                .category(null)
                .templateKey(null)
                .cognitiveDistortions(KeywordLexicon.detectCognitiveDistortions(normalized))
                .build();
    }

    static boolean isGeneric(String response) {
        if (response == null) {
            return true;
        }
        String trimmed = response.trim();
        return trimmed.length() < MIN_RESPONSE_LENGTH || GENERIC_RESPONSES.contains(trimmed);
    }
}
