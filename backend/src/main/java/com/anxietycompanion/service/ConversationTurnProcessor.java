package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.domain.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Handles one user message: append, analyze, gate, reply. Runs on the pipeline's
 * worker thread, one message per conversation at a time.
 */
@Service
@Slf4j
public class ConversationTurnProcessor {

    private final AnxietyAnalysisService analysisService;
    private final CrisisEscalationGate escalationGate;
    private final ResponseComposer responseComposer;
    private final LanguageDetector languageDetector;
    private final ConversationPersistenceService persistenceService;
    private final Clock clock;
    private final int historySize;

    public ConversationTurnProcessor(AnxietyAnalysisService analysisService,
                                     CrisisEscalationGate escalationGate,
                                     ResponseComposer responseComposer,
                                     LanguageDetector languageDetector,
                                     ConversationPersistenceService persistenceService,
                                     Clock clock,
                                     @Value("${app.pipeline.history-size:6}") int historySize) {
        this.analysisService = analysisService;
        this.escalationGate = escalationGate;
        this.responseComposer = responseComposer;
        this.languageDetector = languageDetector;
        this.persistenceService = persistenceService;
        this.clock = clock;
        this.historySize = historySize;
    }

    /**
     * @param isCurrent reports whether this run still holds the conversation's latest
     *                  request token; once it turns false the analysis result is dropped
     * @return the assistant reply, or null when the run was superseded
     */
    public Message process(Conversation conversation, String text, BooleanSupplier isCurrent) {
        Language language = languageDetector.detect(text);
        if (language != conversation.getActiveLanguage()) {
            conversation.switchLanguage(language);
            persistenceService.saveConversation(conversation);
        }

        Message userMessage = conversation.appendUserMessage(text, clock.instant());
        persistenceService.saveMessage(userMessage);

        String replyText;
        boolean escalate;
        try {
            List<String> history = conversation.recentUserTexts(historySize, userMessage.getId());
            Assessment assessment = analysisService.analyze(text, history);

            if (!isCurrent.getAsBoolean()) {
                log.info("Discarding superseded analysis for message {} in conversation {}",
                        userMessage.getId(), conversation.getId());
                return null;
            }

            userMessage.attachAssessment(assessment);
            persistenceService.saveAssessment(userMessage.getId(), assessment);

            int recentHighCount = conversation.assessmentWindow().highAnxietyCount();
            escalate = escalationGate.shouldEscalate(text, assessment, recentHighCount);
            replyText = responseComposer.compose(assessment, language, conversation.getPersona());
        } catch (RuntimeException e) {
            log.error("Turn failed for conversation {}, replying with generic support", conversation.getId(), e);
            escalate = escalationGate.shouldEscalate(text, userMessage.getAssessment(),
                    conversation.assessmentWindow().highAnxietyCount());
            replyText = responseComposer.genericReply(language, conversation.getPersona());
        }

        Message reply = conversation.appendAssistantMessage(replyText, clock.instant(), escalate);
        persistenceService.saveMessage(reply);
        if (escalate) {
            log.warn("Crisis escalation raised for conversation {} at message {}",
                    conversation.getId(), userMessage.getId());
        }
        return reply;
    }
}
