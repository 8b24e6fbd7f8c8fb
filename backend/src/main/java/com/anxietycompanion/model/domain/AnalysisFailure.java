package com.anxietycompanion.model.domain;

public enum AnalysisFailure {
    /** Network error, timeout, missing credentials or a non-success status. */
    REMOTE_UNAVAILABLE,
    /** Missing or malformed structured payload. */
    REMOTE_MALFORMED,
    /** Well-formed payload whose response is a placeholder non-answer. */
    REMOTE_GENERIC
}
