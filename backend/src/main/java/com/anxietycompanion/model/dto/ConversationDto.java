package com.anxietycompanion.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class ConversationDto {
    private UUID id;
    private String persona;
    private String language;
    private OffsetDateTime createdAt;
    private List<MessageDto> messages;
    private String pipelineState;
    private Integer backlogSize;

    @Data
    @Builder
    @AllArgsConstructor
    public static class MessageDto {
        private UUID id;
        private Long sequence;
        private String sender;
        private String text;
        private Boolean crisisEscalation;
        private AssessmentDto assessment;
        private OffsetDateTime createdAt;
    }
}
