package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    void shouldDetectSpanish() {
        assertEquals(Language.ES, detector.detect("Hola, estoy muy ansiosa"));
    }

    @Test
    void shouldRequireMoreThanOneSpanishToken() {
        assertEquals(Language.EN, detector.detect("Hola friend, I had a rough day"));
    }

    @Test
    void shouldDefaultToEnglish() {
        assertEquals(Language.EN, detector.detect("I feel anxious about tomorrow"));
        assertEquals(Language.EN, detector.detect("   "));
        assertEquals(Language.EN, detector.detect(null));
    }
}
