package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.EnumMap;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * Message catalog backed by {@code messages_<lang>.properties}. English is the
 * fallback bundle for missing keys.
 */
@Service
@Slf4j
public class LocalizedMessages {

    private static final String BUNDLE = "messages";

    private final Map<Language, ResourceBundle> bundles = new EnumMap<>(Language.class);

    public LocalizedMessages() {
        ResourceBundle.Control control = ResourceBundle.Control.getNoFallbackControl(
                ResourceBundle.Control.FORMAT_PROPERTIES);
        for (Language language : Language.values()) {
            try {
                bundles.put(language, ResourceBundle.getBundle(BUNDLE, language.toLocale(), control));
            } catch (MissingResourceException e) {
                log.warn("Failed to load message bundle for language: {}", language.getCode());
            }
        }
    }

    public Optional<String> find(String key, Language language, Object... args) {
        ResourceBundle bundle = bundles.get(language);
        if (bundle == null || !bundle.containsKey(key)) {
            return Optional.empty();
        }
        String message = bundle.getString(key);
        if (args != null && args.length > 0) {
            return Optional.of(MessageFormat.format(message, args));
        }
        return Optional.of(message);
    }

    public String get(String key, Language language, Object... args) {
        return find(key, language, args)
                .or(() -> find(key, Language.EN, args))
                .orElseGet(() -> {
                    log.warn("Missing message key: {} for language: {}", key, language.getCode());
                    return key;
                });
    }
}
