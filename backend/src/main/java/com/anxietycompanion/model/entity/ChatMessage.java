package com.anxietycompanion.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "chat_messages", indexes = @Index(name = "idx_chat_messages_session_seq", columnList = "session_id, seq_no"))
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ChatMessage {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "seq_no", nullable = false)
    private Long sequence;

    @Column(nullable = false)
    private String sender;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "crisis_escalation", nullable = false)
    @Builder.Default
    private Boolean crisisEscalation = false;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
