package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Assessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a message raises the crisis-resources interrupt.
 *
 * <p>A single high reading can come from keyword overlap, so the anxiety level alone
 * only escalates once it repeats within the rolling window. Explicit crisis language
 * and a high or critical risk tier escalate immediately.</p>
 */
@Component
@Slf4j
public class CrisisEscalationGate {

    static final int REPEATED_HIGH_THRESHOLD = 2;

    public boolean shouldEscalate(String text, Assessment latestAssessment, int recentHighCount) {
        if (KeywordLexicon.CRISIS.matches(KeywordLexicon.normalize(text))) {
            log.info("Escalating: explicit crisis language");
            return true;
        }
        if (latestAssessment != null && latestAssessment.getCrisisRisk() != null
                && latestAssessment.getCrisisRisk().isSevere()) {
            log.info("Escalating: crisis risk {}", latestAssessment.getCrisisRisk().getCode());
            return true;
        }
        if (recentHighCount >= REPEATED_HIGH_THRESHOLD) {
            log.info("Escalating: {} high-anxiety readings in recent window", recentHighCount);
            return true;
        }
        return false;
    }
}
