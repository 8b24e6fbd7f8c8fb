package com.anxietycompanion.model.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a remote analysis call: either an assessment or a failure kind.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RemoteAnalysisResult {

    Assessment assessment;
    AnalysisFailure failure;
    String detail;

    public static RemoteAnalysisResult success(Assessment assessment) {
        return new RemoteAnalysisResult(assessment, null, null);
    }

    public static RemoteAnalysisResult failure(AnalysisFailure failure, String detail) {
        return new RemoteAnalysisResult(null, failure, detail);
    }

    public boolean isSuccess() {
        return assessment != null;
    }

    public Optional<Assessment> getAssessmentIfPresent() {
        return Optional.ofNullable(assessment);
    }
}
