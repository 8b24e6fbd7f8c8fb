package com.anxietycompanion.model.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The most recent assessments of a conversation, newest first. Derived from the
 * message list on demand and never persisted.
 */
public final class RollingAssessmentWindow {

    public static final int SIZE = 5;
    public static final int HIGH_ANXIETY_LEVEL = 8;

    private final List<Assessment> assessments;

    private RollingAssessmentWindow(List<Assessment> assessments) {
        this.assessments = Collections.unmodifiableList(assessments);
    }

    public static RollingAssessmentWindow from(List<Message> messages) {
        List<Assessment> recent = new ArrayList<>(SIZE);
        for (int i = messages.size() - 1; i >= 0 && recent.size() < SIZE; i--) {
            Assessment assessment = messages.get(i).getAssessment();
            if (assessment != null) {
                recent.add(assessment);
            }
        }
        return new RollingAssessmentWindow(recent);
    }

    public List<Assessment> getAssessments() {
        return assessments;
    }

    public int highAnxietyCount() {
        return (int) assessments.stream()
                .filter(Assessment::isHighAnxiety)
                .count();
    }

    public int size() {
        return assessments.size();
    }
}
