package com.anxietycompanion.model.domain;

public enum PipelineState {
    IDLE,
    PROCESSING
}
