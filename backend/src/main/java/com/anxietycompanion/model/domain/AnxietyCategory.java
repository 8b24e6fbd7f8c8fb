package com.anxietycompanion.model.domain;

/**
 * Severity branches of the heuristic classifier, in precedence order.
 */
public enum AnxietyCategory {
    HALLUCINATION("hallucination"),
    PANIC("panic"),
    TRAUMA("trauma"),
    OCD("ocd"),
    VIOLENT_IDEATION("violent"),
    GRIEF_BETRAYAL("grief"),
    GENERALIZED_WORRY("gad"),
    OVERWHELM("overwhelm"),
    SADNESS("sadness"),
    ANXIETY("anxiety"),
    SLEEP("sleep"),
    NEUTRAL("neutral");

    private final String templateKey;

    AnxietyCategory(String templateKey) {
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
