package com.anxietycompanion.model.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured result of classifying one message. Instances are immutable; the
 * {@link #source} tag tells consumers which analysis path produced it.
 */
@Value
@Builder(toBuilder = true)
public class Assessment {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 10;

    int anxietyLevel;

    @Builder.Default
    List<String> triggers = List.of();

    @Builder.Default
    List<String> copingStrategies = List.of();

    String personalizedResponse;

    AnalysisSource source;

    CrisisRisk crisisRisk;

    /** Matched classifier branch; null for remote assessments. */
    AnxietyCategory category;

    /** Localization key of the fallback response template; null for remote assessments. */
    String templateKey;

    @Builder.Default
    List<String> cognitiveDistortions = List.of();

    public boolean isHighAnxiety() {
        return anxietyLevel >= RollingAssessmentWindow.HIGH_ANXIETY_LEVEL;
    }

    public static int clampLevel(int level) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }
}
