package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Language;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class LanguageDetector {

    static final int SPANISH_THRESHOLD = 2;

    private static final List<String> SPANISH_TOKENS = List.of(
            "hola", "gracias", "estoy", "estás", "necesito", "ayuda", "ansiedad", "ánimo", "mañana",
            "porque", "qué", "cómo", "sí", "tengo", "muy", "aquí", "por favor", "siento");

    /**
     * Per-message guess; never sticky, so a mid-conversation switch takes effect at once.
     */
    public Language detect(String text) {
        if (text == null || text.isBlank()) {
            return Language.EN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long hits = SPANISH_TOKENS.stream()
                .filter(lower::contains)
                .count();
        return hits >= SPANISH_THRESHOLD ? Language.ES : Language.EN;
    }
}
