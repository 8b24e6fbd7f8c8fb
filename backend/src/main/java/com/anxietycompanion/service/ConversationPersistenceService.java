package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.AnalysisSource;
import com.anxietycompanion.model.domain.AnxietyCategory;
import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.CrisisRisk;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.domain.Message;
import com.anxietycompanion.model.domain.Sender;
import com.anxietycompanion.model.entity.AnxietyAnalysis;
import com.anxietycompanion.model.entity.ChatMessage;
import com.anxietycompanion.model.entity.ChatSession;
import com.anxietycompanion.repository.AnxietyAnalysisRepository;
import com.anxietycompanion.repository.ChatMessageRepository;
import com.anxietycompanion.repository.ChatSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Storage side of the conversation. Writes are fire-and-forget on the single-threaded
 * persistence executor; a failed write is logged and the in-memory state stays
 * authoritative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationPersistenceService {

    private static final String LIST_SEPARATOR = "\n";

    private final ChatSessionRepository chatSessionRepository;
    private final ChatMessageRepository chatMessageRepository;
    private final AnxietyAnalysisRepository anxietyAnalysisRepository;

    @Async("persistenceExecutor")
    public void saveConversation(Conversation conversation) {
        try {
            ChatSession session = chatSessionRepository.findById(conversation.getId())
                    .orElse(ChatSession.builder()
                            .id(conversation.getId())
                            .build());
            session.setAiCompanion(conversation.getPersona().getCode());
            session.setLanguage(conversation.getActiveLanguage().getCode());
            chatSessionRepository.save(session);
        } catch (RuntimeException e) {
            log.error("Persistence failure saving conversation {}", conversation.getId(), e);
        }
    }

    @Async("persistenceExecutor")
    public void saveMessage(Message message) {
        try {
            chatMessageRepository.save(ChatMessage.builder()
                    .id(message.getId())
                    .sessionId(message.getConversationId())
                    .sequence(message.getSequence())
                    .sender(message.getSender().getCode())
                    .content(message.getText())
                    .crisisEscalation(message.isCrisisEscalation())
                    .createdAt(OffsetDateTime.ofInstant(message.getCreatedAt(), ZoneOffset.UTC))
                    .build());
        } catch (RuntimeException e) {
            log.error("Persistence failure saving message {} of conversation {}",
                    message.getId(), message.getConversationId(), e);
        }
    }

    @Async("persistenceExecutor")
    public void saveAssessment(UUID messageId, Assessment assessment) {
        try {
            anxietyAnalysisRepository.save(AnxietyAnalysis.builder()
                    .messageId(messageId)
                    .anxietyLevel(assessment.getAnxietyLevel())
                    .analysisSource(assessment.getSource().getCode())
                    .crisisRisk(assessment.getCrisisRisk().getCode())
                    .category(assessment.getCategory() != null ? assessment.getCategory().name() : null)
                    .templateKey(assessment.getTemplateKey())
                    .anxietyTriggers(joinList(assessment.getTriggers()))
                    .copingStrategies(joinList(assessment.getCopingStrategies()))
                    .cognitiveDistortions(joinList(assessment.getCognitiveDistortions()))
                    .personalizedResponse(assessment.getPersonalizedResponse())
                    .build());
        } catch (RuntimeException e) {
            log.error("Persistence failure saving assessment for message {}", messageId, e);
        }
    }

    /**
     * Rebuilds a conversation from storage, messages in sequence order.
     */
    @Transactional(readOnly = true)
    public Optional<Conversation> loadConversation(UUID conversationId) {
        Optional<ChatSession> session = chatSessionRepository.findById(conversationId);
        if (session.isEmpty()) {
            return Optional.empty();
        }

        ChatSession chatSession = session.get();
        Conversation conversation = new Conversation(
                chatSession.getId(),
                CompanionPersona.fromCode(chatSession.getAiCompanion()),
                Language.fromCode(chatSession.getLanguage()),
                chatSession.getCreatedAt() != null ? chatSession.getCreatedAt().toInstant() : null);

        List<ChatMessage> stored = chatMessageRepository.findBySessionIdOrderBySequenceAsc(conversationId);
        Map<UUID, AnxietyAnalysis> analyses = anxietyAnalysisRepository
                .findByMessageIdIn(stored.stream().map(ChatMessage::getId).toList())
                .stream()
                .collect(Collectors.toMap(AnxietyAnalysis::getMessageId, Function.identity(), (a, b) -> a));

        for (ChatMessage row : stored) {
            AnxietyAnalysis analysis = analyses.get(row.getId());
            conversation.restore(new Message(
                    row.getId(),
                    row.getSessionId(),
                    Sender.fromCode(row.getSender()),
                    row.getContent(),
                    row.getCreatedAt() != null ? row.getCreatedAt().toInstant() : Instant.EPOCH,
                    row.getSequence(),
                    Boolean.TRUE.equals(row.getCrisisEscalation()),
                    analysis != null ? toAssessment(analysis) : null));
        }

        log.info("Reloaded conversation {} with {} messages", conversationId, stored.size());
        return Optional.of(conversation);
    }

    private Assessment toAssessment(AnxietyAnalysis analysis) {
        return Assessment.builder()
                .anxietyLevel(Assessment.clampLevel(analysis.getAnxietyLevel()))
                .source(AnalysisSource.fromCode(analysis.getAnalysisSource()))
                .crisisRisk(CrisisRisk.fromCode(analysis.getCrisisRisk()))
                .category(toCategory(analysis))
                .templateKey(analysis.getTemplateKey())
                .triggers(splitList(analysis.getAnxietyTriggers()))
                .copingStrategies(splitList(analysis.getCopingStrategies()))
                .cognitiveDistortions(splitList(analysis.getCognitiveDistortions()))
                .personalizedResponse(analysis.getPersonalizedResponse())
                .build();
    }

    private String joinList(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join(LIST_SEPARATOR, values);
    }

    private AnxietyCategory toCategory(AnxietyAnalysis analysis) {
        if (analysis.getCategory() == null) {
            return null;
        }
        try {
            return AnxietyCategory.valueOf(analysis.getCategory());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown stored category '{}' for message {}, ignoring", analysis.getCategory(),
                    analysis.getMessageId());
            return null;
        }
    }

    private List<String> splitList(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(LIST_SEPARATOR)).toList();
    }
}
