package com.anxietycompanion.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "chat_sessions")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ChatSession {

    // Assigned by the in-memory conversation, not generated.
    @Id
    private UUID id;

    @Column(nullable = false)
    @Builder.Default
    private String title = "New Chat Session";

    @Column(name = "ai_companion", nullable = false)
    @Builder.Default
    private String aiCompanion = "vanessa";

    @Column(nullable = false)
    @Builder.Default
    private String language = "en";

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
