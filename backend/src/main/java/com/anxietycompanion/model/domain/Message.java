package com.anxietycompanion.model.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry of a conversation. Everything but the assessment is fixed at creation;
 * the assessment can be attached once, and only to a user message.
 */
@Getter
public class Message {

    private final UUID id;
    private final UUID conversationId;
    private final Sender sender;
    private final String text;
    private final Instant createdAt;
    private final long sequence;
    private final boolean crisisEscalation;
    private volatile Assessment assessment;

    public Message(UUID id, UUID conversationId, Sender sender, String text, Instant createdAt,
                   long sequence, boolean crisisEscalation, Assessment assessment) {
        this.id = Objects.requireNonNull(id, "id");
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.text = Objects.requireNonNull(text, "text");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.sequence = sequence;
        this.crisisEscalation = crisisEscalation;
        this.assessment = assessment;
    }

    public synchronized void attachAssessment(Assessment assessment) {
        Objects.requireNonNull(assessment, "assessment");
        if (sender != Sender.USER) {
            throw new IllegalStateException("Assessments attach to user messages only: " + id);
        }
        if (this.assessment != null) {
            throw new IllegalStateException("Assessment already attached to message " + id);
        }
        this.assessment = assessment;
    }

    public boolean hasAssessment() {
        return assessment != null;
    }

    public boolean isFromUser() {
        return sender == Sender.USER;
    }
}
