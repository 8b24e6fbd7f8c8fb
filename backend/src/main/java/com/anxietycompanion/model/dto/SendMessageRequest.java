package com.anxietycompanion.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {
    @NotBlank(message = "Message is required")
    @Size(max = 4000, message = "Message too long")
    private String text;
}
