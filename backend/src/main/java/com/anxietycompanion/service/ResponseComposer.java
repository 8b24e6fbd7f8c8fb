package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Language;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Picks the reply text for an assessment in the language of the message. The persona
 * only frames greetings and the generic reply; coping content is persona-neutral.
 */
@Component
@RequiredArgsConstructor
public class ResponseComposer {

    private static final String RESPONSE_PREFIX = "response.";

    private final LocalizedMessages messages;

    public String compose(Assessment assessment, Language language, CompanionPersona persona) {
        if (assessment == null || !StringUtils.hasText(assessment.getPersonalizedResponse())) {
            return genericReply(language, persona);
        }
        return switch (assessment.getSource()) {
            // The remote prompt already asks for the user's language.
            case REMOTE -> assessment.getPersonalizedResponse();
            case FALLBACK -> localizeFallback(assessment, language);
        };
    }

    public String genericReply(Language language, CompanionPersona persona) {
        return messages.get("reply.generic", language, persona.getDisplayName());
    }

    public String welcome(Language language, CompanionPersona persona) {
        return messages.get("welcome." + persona.getCode(), language, persona.getDisplayName());
    }

    private String localizeFallback(Assessment assessment, Language language) {
        if (language == Language.EN || assessment.getTemplateKey() == null) {
            return assessment.getPersonalizedResponse();
        }
        return messages.find(RESPONSE_PREFIX + assessment.getTemplateKey(), language)
                .orElse(assessment.getPersonalizedResponse());
    }
}
