package com.anxietycompanion.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class AnalysisRequest {
    @NotBlank(message = "Message is required")
    @Size(max = 4000, message = "Message too long")
    private String message;

    private List<String> recentHistory;
}
