package com.anxietycompanion.model.dto;

import com.anxietycompanion.model.domain.Assessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class AssessmentDto {
    private Integer anxietyLevel;
    private List<String> triggers;
    private List<String> copingStrategies;
    private List<String> cognitiveDistortions;
    private String personalizedResponse;
    private String source;
    private String crisisRisk;
    private String category;

    public static AssessmentDto from(Assessment assessment) {
        if (assessment == null) {
            return null;
        }
        return AssessmentDto.builder()
                .anxietyLevel(assessment.getAnxietyLevel())
                .triggers(assessment.getTriggers())
                .copingStrategies(assessment.getCopingStrategies())
                .cognitiveDistortions(assessment.getCognitiveDistortions())
                .personalizedResponse(assessment.getPersonalizedResponse())
                .source(assessment.getSource() != null ? assessment.getSource().getCode() : null)
                .crisisRisk(assessment.getCrisisRisk() != null ? assessment.getCrisisRisk().getCode() : null)
                .category(assessment.getCategory() != null ? assessment.getCategory().getTemplateKey() : null)
                .build();
    }
}
