package com.anxietycompanion.model.dto;

import com.anxietycompanion.model.domain.SubmissionOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SubmissionResponse {
    private SubmissionOutcome outcome;
}
