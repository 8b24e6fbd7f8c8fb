package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalizedMessagesTest {

    private final LocalizedMessages messages = new LocalizedMessages();

    @Test
    void shouldFormatArguments() {
        assertTrue(messages.get("reply.generic", Language.ES, "Mónica").startsWith("Soy Mónica"));
    }

    @Test
    void shouldFallBackToEnglishForMissingKey() {
        assertTrue(messages.find("response.panic", Language.EN).isEmpty());
        assertTrue(messages.get("welcome.vanessa", Language.EN, "Vanessa").contains("Vanessa"));
    }

    @Test
    void shouldReturnKeyWhenMissingEverywhere() {
        assertEquals("missing.key", messages.get("missing.key", Language.ES));
    }
}
