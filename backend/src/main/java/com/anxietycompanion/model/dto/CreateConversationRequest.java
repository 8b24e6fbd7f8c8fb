package com.anxietycompanion.model.dto;

import lombok.Data;

@Data
public class CreateConversationRequest {
    private String persona;
    private String language;
}
