package com.anxietycompanion.service;

import com.anxietycompanion.exception.NotFoundException;
import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.domain.Message;
import com.anxietycompanion.model.domain.PipelineState;
import com.anxietycompanion.model.domain.Sender;
import com.anxietycompanion.model.domain.SubmissionOutcome;
import com.anxietycompanion.model.dto.ConversationDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final long IDLE_TTL_MINUTES = 30;

    private ConversationPipeline pipeline;
    private ConversationPersistenceService persistenceService;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        pipeline = mock(ConversationPipeline.class);
        persistenceService = mock(ConversationPersistenceService.class);
        service = new ConversationService(pipeline, persistenceService,
                new ResponseComposer(new LocalizedMessages()), CLOCK, IDLE_TTL_MINUTES, 5);
    }

    @Test
    void shouldStartWithPersonaWelcome() {
        Conversation conversation = service.startConversation(CompanionPersona.MONICA, Language.ES);

        assertEquals(1, conversation.size());
        Message welcome = conversation.getMessages().get(0);
        assertEquals(Sender.ASSISTANT, welcome.getSender());
        assertTrue(welcome.getText().contains("Mónica"));
        verify(persistenceService).saveConversation(conversation);
        verify(persistenceService).saveMessage(welcome);
        assertSame(conversation, service.getConversation(conversation.getId()));
    }

    @Test
    void shouldReloadConversationFromStorageOnce() {
        Conversation stored = new Conversation(UUID.randomUUID(), CompanionPersona.VANESSA, Language.EN,
                CLOCK.instant());
        when(persistenceService.loadConversation(stored.getId())).thenReturn(Optional.of(stored));

        assertSame(stored, service.getConversation(stored.getId()));
        assertSame(stored, service.getConversation(stored.getId()));
        verify(persistenceService, times(1)).loadConversation(stored.getId());
    }

    @Test
    void shouldRejectUnknownConversation() {
        UUID id = UUID.randomUUID();
        when(persistenceService.loadConversation(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.submitMessage(id, "hello"));
        verify(pipeline, never()).submit(any(), any());
    }

    @Test
    void shouldRouteSubmissionsToPipeline() {
        Conversation conversation = service.startConversation(CompanionPersona.VANESSA, Language.EN);
        when(pipeline.submit(conversation, "hello")).thenReturn(SubmissionOutcome.STARTED);
        when(pipeline.resend(conversation, "hello again")).thenReturn(SubmissionOutcome.QUEUED);

        assertEquals(SubmissionOutcome.STARTED, service.submitMessage(conversation.getId(), "hello"));
        assertEquals(SubmissionOutcome.QUEUED, service.resendMessage(conversation.getId(), "hello again"));
    }

    @Test
    void shouldMapConversationToDto() {
        Conversation conversation = service.startConversation(CompanionPersona.VANESSA, Language.EN);
        when(pipeline.stateOf(conversation.getId())).thenReturn(PipelineState.PROCESSING);
        when(pipeline.backlogSize(conversation.getId())).thenReturn(2);

        ConversationDto dto = service.toDto(conversation);

        assertEquals("vanessa", dto.getPersona());
        assertEquals("en", dto.getLanguage());
        assertEquals("PROCESSING", dto.getPipelineState());
        assertEquals(2, dto.getBacklogSize());
        assertEquals(1, dto.getMessages().size());
        assertEquals("assistant", dto.getMessages().get(0).getSender());
        assertEquals(0L, dto.getMessages().get(0).getSequence());
    }

    @Test
    void shouldEvictIdleConversationAndReloadOnNextAccess() {
        AtomicReference<Instant> now = new AtomicReference<>(CLOCK.instant());
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now.get());
        ConversationService evicting = new ConversationService(pipeline, persistenceService,
                new ResponseComposer(new LocalizedMessages()), clock, IDLE_TTL_MINUTES, 5);
        when(pipeline.evictIfIdle(any())).thenReturn(true);

        Conversation started = evicting.startConversation(CompanionPersona.VANESSA, Language.EN);
        now.set(now.get().plus(Duration.ofMinutes(10)));
        assertEquals(0, evicting.evictIdleConversations());

        now.set(now.get().plus(Duration.ofMinutes(IDLE_TTL_MINUTES)));
        assertEquals(1, evicting.evictIdleConversations());
        verify(pipeline).evictIfIdle(started.getId());

        Conversation stored = new Conversation(started.getId(), CompanionPersona.VANESSA, Language.EN,
                started.getCreatedAt());
        when(persistenceService.loadConversation(started.getId())).thenReturn(Optional.of(stored));

        Conversation reloaded = evicting.getConversation(started.getId());

        assertNotSame(started, reloaded);
        assertSame(stored, reloaded);
        verify(persistenceService).loadConversation(started.getId());
    }

    @Test
    void shouldKeepConversationWhilePipelineIsBusy() {
        AtomicReference<Instant> now = new AtomicReference<>(CLOCK.instant());
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now.get());
        ConversationService evicting = new ConversationService(pipeline, persistenceService,
                new ResponseComposer(new LocalizedMessages()), clock, IDLE_TTL_MINUTES, 5);
        when(pipeline.evictIfIdle(any())).thenReturn(false);

        Conversation started = evicting.startConversation(CompanionPersona.VANESSA, Language.EN);
        now.set(now.get().plus(Duration.ofMinutes(IDLE_TTL_MINUTES + 1)));

        assertEquals(0, evicting.evictIdleConversations());
        assertSame(started, evicting.getConversation(started.getId()));
        verify(persistenceService, never()).loadConversation(started.getId());
    }
}
