package com.anxietycompanion.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "anxiety_analyses")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class AnxietyAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "message_id", nullable = false, unique = true)
    private UUID messageId;

    @Column(name = "anxiety_level", nullable = false)
    private Integer anxietyLevel;

    @Column(name = "analysis_source", nullable = false)
    @Builder.Default
    private String analysisSource = "fallback";

    @Column(name = "crisis_risk", nullable = false)
    @Builder.Default
    private String crisisRisk = "low";

    @Column(name = "category")
    private String category;

    @Column(name = "template_key")
    private String templateKey;

    // Newline-joined lists; the values are short labels without line breaks.
    @Column(name = "anxiety_triggers", columnDefinition = "TEXT")
    private String anxietyTriggers;

    @Column(name = "coping_strategies", columnDefinition = "TEXT")
    private String copingStrategies;

    @Column(name = "cognitive_distortions", columnDefinition = "TEXT")
    private String cognitiveDistortions;

    @Column(name = "personalized_response", columnDefinition = "TEXT")
    private String personalizedResponse;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
