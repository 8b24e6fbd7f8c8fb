package com.anxietycompanion.service;

import com.anxietycompanion.exception.NotFoundException;
import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.domain.Message;
import com.anxietycompanion.model.domain.SubmissionOutcome;
import com.anxietycompanion.model.dto.AssessmentDto;
import com.anxietycompanion.model.dto.ConversationDto;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Registry of active conversations. A conversation not held in memory is reloaded
 * from storage on first access. Conversations left idle longer than the configured
 * TTL are dropped from memory together with their pipeline runner.
 */
@Service
@Slf4j
public class ConversationService {

    private final ConversationPipeline pipeline;
    private final ConversationPersistenceService persistenceService;
    private final ResponseComposer responseComposer;
    private final Clock clock;
    private final Duration idleTtl;
    private final long evictionIntervalMinutes;

    private final Map<UUID, ActiveConversation> active = new ConcurrentHashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "conversation-eviction");
        t.setDaemon(true);
        return t;
    });

    public ConversationService(ConversationPipeline pipeline,
                               ConversationPersistenceService persistenceService,
                               ResponseComposer responseComposer,
                               Clock clock,
                               @Value("${app.conversation.idle-ttl-minutes:30}") long idleTtlMinutes,
                               @Value("${app.conversation.eviction-interval-minutes:5}") long evictionIntervalMinutes) {
        this.pipeline = pipeline;
        this.persistenceService = persistenceService;
        this.responseComposer = responseComposer;
        this.clock = clock;
        this.idleTtl = Duration.ofMinutes(idleTtlMinutes);
        this.evictionIntervalMinutes = evictionIntervalMinutes;
    }

    @PostConstruct
    void init() {
        evictionExecutor.scheduleAtFixedRate(this::evictIdleConversations,
                evictionIntervalMinutes, evictionIntervalMinutes, TimeUnit.MINUTES);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public Conversation startConversation(CompanionPersona persona, Language language) {
        Conversation conversation = Conversation.start(persona, language, clock.instant());
        Message welcome = conversation.appendAssistantMessage(
                responseComposer.welcome(conversation.getActiveLanguage(), conversation.getPersona()),
                clock.instant(), false);
        active.put(conversation.getId(), new ActiveConversation(conversation, clock.instant()));

        persistenceService.saveConversation(conversation);
        persistenceService.saveMessage(welcome);
        log.info("Started conversation {} with {} ({})", conversation.getId(),
                conversation.getPersona().getCode(), conversation.getActiveLanguage().getCode());
        return conversation;
    }

    public Conversation getConversation(UUID conversationId) {
        return withConversation(conversationId, Function.identity());
    }

    public SubmissionOutcome submitMessage(UUID conversationId, String text) {
        return withConversation(conversationId, conversation -> pipeline.submit(conversation, text));
    }

    public SubmissionOutcome resendMessage(UUID conversationId, String text) {
        return withConversation(conversationId, conversation -> pipeline.resend(conversation, text));
    }

    /**
     * Drops conversations idle for longer than the TTL whose pipeline has nothing
     * running or waiting. Returns the number evicted.
     */
    int evictIdleConversations() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<UUID, ActiveConversation> e : active.entrySet()) {
            ActiveConversation entry = e.getValue();
            synchronized (entry) {
                if (entry.evicted || Duration.between(entry.lastAccess, now).compareTo(idleTtl) < 0) {
                    continue;
                }
                if (!pipeline.evictIfIdle(e.getKey())) {
                    continue;
                }
                entry.evicted = true;
                active.remove(e.getKey(), entry);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle conversations, {} still active", evicted, active.size());
        }
        return evicted;
    }

    private <T> T withConversation(UUID conversationId, Function<Conversation, T> action) {
        while (true) {
            ActiveConversation entry = active.get(conversationId);
            if (entry == null) {
                Conversation loaded = persistenceService.loadConversation(conversationId)
                        .orElseThrow(() -> new NotFoundException("Conversation not found"));
                ActiveConversation fresh = new ActiveConversation(loaded, clock.instant());
                ActiveConversation existing = active.putIfAbsent(conversationId, fresh);
                entry = existing != null ? existing : fresh;
            }
            synchronized (entry) {
                if (entry.evicted) {
                    continue;
                }
                entry.lastAccess = clock.instant();
                return action.apply(entry.conversation);
            }
        }
    }

    public ConversationDto toDto(Conversation conversation) {
        List<ConversationDto.MessageDto> messages = conversation.getMessages().stream()
                .map(m -> ConversationDto.MessageDto.builder()
                        .id(m.getId())
                        .sequence(m.getSequence())
                        .sender(m.getSender().getCode())
                        .text(m.getText())
                        .crisisEscalation(m.isCrisisEscalation())
                        .assessment(AssessmentDto.from(m.getAssessment()))
                        .createdAt(OffsetDateTime.ofInstant(m.getCreatedAt(), ZoneOffset.UTC))
                        .build())
                .toList();

        return ConversationDto.builder()
                .id(conversation.getId())
                .persona(conversation.getPersona().getCode())
                .language(conversation.getActiveLanguage().getCode())
                .createdAt(OffsetDateTime.ofInstant(conversation.getCreatedAt(), ZoneOffset.UTC))
                .messages(messages)
                .pipelineState(pipeline.stateOf(conversation.getId()).name())
                .backlogSize(pipeline.backlogSize(conversation.getId()))
                .build();
    }

    private static final class ActiveConversation {
        private final Conversation conversation;
        private Instant lastAccess;
        private boolean evicted;

        private ActiveConversation(Conversation conversation, Instant lastAccess) {
            this.conversation = conversation;
            this.lastAccess = lastAccess;
        }
    }
}
