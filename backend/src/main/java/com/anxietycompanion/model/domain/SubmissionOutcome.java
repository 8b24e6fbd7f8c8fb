package com.anxietycompanion.model.domain;

public enum SubmissionOutcome {
    STARTED,
    QUEUED,
    DUPLICATE_DROPPED
}
