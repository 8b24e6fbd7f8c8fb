package com.anxietycompanion.model.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory conversation state. The message list is append-only and its order is
 * the order of {@link Message#getSequence()}.
 */
public class Conversation {

    @Getter
    private final UUID id;
    @Getter
    private final CompanionPersona persona;
    @Getter
    private final Instant createdAt;
    private volatile Language activeLanguage;

    private final List<Message> messages = new ArrayList<>();
    private long nextSequence;

    public Conversation(UUID id, CompanionPersona persona, Language activeLanguage, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.persona = persona != null ? persona : CompanionPersona.VANESSA;
        this.activeLanguage = activeLanguage != null ? activeLanguage : this.persona.getDefaultLanguage();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static Conversation start(CompanionPersona persona, Language language, Instant now) {
        return new Conversation(UUID.randomUUID(), persona, language, now);
    }

    public Language getActiveLanguage() {
        return activeLanguage;
    }

    public void switchLanguage(Language language) {
        if (language != null) {
            this.activeLanguage = language;
        }
    }

    public Message appendUserMessage(String text, Instant now) {
        return append(Sender.USER, text, now, false);
    }

    public Message appendAssistantMessage(String text, Instant now, boolean crisisEscalation) {
        return append(Sender.ASSISTANT, text, now, crisisEscalation);
    }

    private synchronized Message append(Sender sender, String text, Instant now, boolean crisisEscalation) {
        Message message = new Message(UUID.randomUUID(), id, sender, text, now,
                nextSequence++, crisisEscalation, null);
        messages.add(message);
        return message;
    }

    /**
     * Re-adds a message loaded from storage. Messages must arrive in sequence order;
     * stored sequences may have gaps left by failed writes, so new messages continue
     * after the highest restored one.
     */
    public synchronized void restore(Message message) {
        if (!id.equals(message.getConversationId())) {
            throw new IllegalArgumentException("Message " + message.getId() + " belongs to another conversation");
        }
        messages.add(message);
        nextSequence = Math.max(nextSequence, message.getSequence() + 1);
    }

    public synchronized List<Message> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized Optional<Message> findMessage(UUID messageId) {
        return messages.stream()
                .filter(m -> m.getId().equals(messageId))
                .findFirst();
    }

    public synchronized int size() {
        return messages.size();
    }

    /**
     * Texts of the most recent user messages, oldest first, excluding {@code excludeId}.
     */
    public synchronized List<String> recentUserTexts(int limit, UUID excludeId) {
        List<String> texts = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0 && texts.size() < limit; i--) {
            Message message = messages.get(i);
            if (message.isFromUser() && !message.getId().equals(excludeId)) {
                texts.add(0, message.getText());
            }
        }
        return texts;
    }

    public RollingAssessmentWindow assessmentWindow() {
        return RollingAssessmentWindow.from(getMessages());
    }
}
