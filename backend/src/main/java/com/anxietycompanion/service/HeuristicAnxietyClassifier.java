package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.AnalysisSource;
import com.anxietycompanion.model.domain.AnxietyCategory;
import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.CrisisRisk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.function.Predicate;

/**
 * Local, deterministic anxiety classifier used whenever the remote model cannot
 * answer. Identical input always yields an equal {@link Assessment}.
 *
 * <p>The severity branches are evaluated in a fixed order and the first match wins.
 * Trigger categories and cognitive distortions are detected independently of the
 * branch that fired.</p>
 */
@Component
public class HeuristicAnxietyClassifier {

    static final int BASE_LEVEL = 3;
    static final int HISTORY_LOOKBACK = 3;

    private static final List<String> NEUTRAL_RESPONSES = List.of(
            "I'm here. What's on your mind today?",
            "Thanks for reaching out. What's happening?",
            "I'm listening. Tell me what you're feeling.",
            "You're not alone. What's going on?");

    private static final List<String> NEUTRAL_COPING = List.of(
            "Deep breathing", "Take a walk", "Call someone", "Self-care");

    private static final List<Rule> RULES = List.of(
            new Rule(AnxietyCategory.HALLUCINATION, s -> s.psychosis, level -> 10,
                    List.of("Paranoia", "Fear", "Crisis"),
                    List.of("Name 5 things you see RIGHT NOW",
                            "Splash cold water on face or hold ice",
                            "Call 988 or go to ER immediately",
                            "Stay with someone trusted"),
                    "Right now: Look around and name 5 things you can see. Touch something cold - ice or cold "
                            + "water on your face. Breathe slowly: in for 4, out for 6. If this continues, call 988 "
                            + "immediately."),
            new Rule(AnxietyCategory.PANIC, s -> s.panic, level -> 8,
                    List.of("Panic attack", "Acute anxiety"),
                    List.of("Square breathing: 4-4-4-4 pattern",
                            "Ice cube on wrist or neck",
                            "Count backwards from 100 by 7s",
                            "This WILL pass in 10-20 minutes"),
                    "This is panic, not danger. Breathe: in for 4, hold for 4, out for 6. Five times. Place hand "
                            + "on chest - you're okay. This will pass in 10-20 minutes."),
            new Rule(AnxietyCategory.TRAUMA, s -> s.trauma, level -> 7,
                    List.of("PTSD", "Trauma response", "Flashback"),
                    List.of("5-4-3-2-1 grounding NOW",
                            "Smell something strong (coffee, essential oil)",
                            "Bilateral stimulation: tap shoulders alternately",
                            "Remind yourself: \"That was then, this is now\""),
                    "You're having a trauma response. You're safe now. Ground yourself: 5 things you see, 4 you "
                            + "hear, 3 you touch. The flashback will pass."),
            new Rule(AnxietyCategory.OCD, s -> s.ocd, level -> 6,
                    List.of("OCD", "Intrusive thoughts", "Compulsions"),
                    List.of("Delay the ritual by 5 minutes",
                            "Write the thought down, then close the notebook",
                            "Do opposite action (if checking, walk away)",
                            "Remember: thoughts are not facts"),
                    "OCD is loud right now. Don't do the compulsion. Set a 5-minute timer - sit with the "
                            + "discomfort. The urge will peak and fade. You can handle this."),
            new Rule(AnxietyCategory.VIOLENT_IDEATION, s -> s.violent, level -> Math.max(level, 8),
                    List.of("Crisis", "Severe distress", "Danger"),
                    List.of("Leave the room immediately",
                            "Count 10 breaths out loud",
                            "Call 988 now or text HOME to 741741",
                            "Go for a walk outside"),
                    "Your pain is real. Right now: Step outside or to another room. Take 10 deep breaths, count "
                            + "them out loud. Then call 988 - they're available 24/7 to help you through this "
                            + "safely."),
            new Rule(AnxietyCategory.GRIEF_BETRAYAL, s -> s.relationship && s.depression, IntUnaryOperator.identity(),
                    List.of("Betrayal", "Loss", "Grief"),
                    List.of("Breathe: 4-4-6 pattern, 5 times",
                            "Call one trusted friend now",
                            "Write your feelings for 10 minutes",
                            "Take care of basics: eat, sleep, shower"),
                    "This betrayal is devastating. Right now, breathe: in for 4, hold for 4, out for 6. Do this "
                            + "5 times. Then call one person who cares about you. This intense pain will ease with "
                            + "time."),
            new Rule(AnxietyCategory.GENERALIZED_WORRY, s -> s.generalizedWorry, level -> 6,
                    List.of("GAD", "Chronic worry", "Anxiety"),
                    List.of("Worry time: set 15 min to worry, then stop",
                            "Progressive muscle relaxation",
                            "Challenge thoughts: \"Is this likely?\"",
                            "Focus on ONE task for next hour"),
                    "Constant worry is exhausting. Right now: write down your top 3 worries. Circle what you can "
                            + "control today. Start with the smallest one."),
            new Rule(AnxietyCategory.OVERWHELM, s -> s.level > 6, IntUnaryOperator.identity(),
                    List.of("Stress", "Overwhelm"),
                    List.of("Breathe: 4-4-6, three times",
                            "Walk for 5 minutes",
                            "Call a friend",
                            "Write it out"),
                    "You're dealing with something heavy. Let's breathe together: in for 4, hold for 4, out for 6. "
                            + "Do this 3 times. Then tell me what's happening."),
            new Rule(AnxietyCategory.SADNESS, s -> s.sadness, level -> 5,
                    List.of("Sadness", "Low mood"),
                    List.of("One small act of self-care now",
                            "Walk outside for 5 minutes",
                            "Text someone you trust",
                            "Let yourself cry if you need to"),
                    "I hear your sadness. It's okay to feel this way. Right now, do one kind thing for yourself - "
                            + "maybe a cup of tea or step outside for fresh air. What's making you sad?"),
            new Rule(AnxietyCategory.ANXIETY, s -> s.anxiety, level -> 6,
                    List.of("Anxiety", "Worry"),
                    List.of("4-7-8 breathing, 3 times",
                            "Name 5 things you see",
                            "Walk around the room",
                            "Hold ice or cold water"),
                    "Anxiety is tough. Right now: breathe in for 4, hold for 7, out for 8. Do this 3 times. Then "
                            + "name 5 things you can see. This will help calm your nervous system."),
            new Rule(AnxietyCategory.SLEEP, s -> s.sleep, level -> 5,
                    List.of("Insomnia", "Sleep anxiety"),
                    List.of("4-7-8 breathing in bed",
                            "Progressive muscle relaxation",
                            "Write worries on paper, leave by bed",
                            "Cool room, warm feet"),
                    "Racing mind at night is hard. Try 4-7-8 breathing five times. Then do a body scan: tense and "
                            + "release each muscle group. No screens for next hour."));

    public Assessment classify(String text, List<String> recentHistory) {
        Signals signals = Signals.read(text, recentHistory);

        for (Rule rule : RULES) {
            if (rule.matcher.test(signals)) {
                return build(signals, rule.category, rule.category.getTemplateKey(),
                        rule.level.applyAsInt(signals.level), rule.triggers, rule.coping, rule.response);
            }
        }

        int variant = Math.floorMod(signals.normalized.hashCode(), NEUTRAL_RESPONSES.size());
        List<String> triggers = signals.indicatorHits > 0 ? List.of("Stress") : List.of();
        return build(signals, AnxietyCategory.NEUTRAL, AnxietyCategory.NEUTRAL.getTemplateKey() + "." + variant,
                signals.level, triggers, NEUTRAL_COPING, NEUTRAL_RESPONSES.get(variant));
    }

    private Assessment build(Signals signals, AnxietyCategory category, String templateKey, int rawLevel,
                             List<String> branchTriggers, List<String> coping, String response) {
        int level = Assessment.clampLevel(rawLevel);

        Set<String> triggers = new LinkedHashSet<>(branchTriggers);
        triggers.addAll(KeywordLexicon.detectTriggerCategories(signals.normalized));

        boolean crisisSignal = category == AnxietyCategory.HALLUCINATION || signals.crisisKeyword;

        return Assessment.builder()
                .anxietyLevel(level)
                .triggers(List.copyOf(triggers))
                .copingStrategies(coping)
                .personalizedResponse(response)
                .source(AnalysisSource.FALLBACK)
                .crisisRisk(CrisisRisk.derive(level, crisisSignal))
                .category(category)
                .templateKey(templateKey)
                .cognitiveDistortions(KeywordLexicon.detectCognitiveDistortions(signals.normalized))
                .build();
    }

    private record Rule(AnxietyCategory category, Predicate<Signals> matcher, IntUnaryOperator level,
                        List<String> triggers, List<String> coping, String response) {
    }

    /**
     * Everything the rules look at, computed once per message.
     */
    private static final class Signals {

        private String normalized;
        private boolean crisisKeyword;
        private boolean psychosis;
        private boolean panic;
        private boolean trauma;
        private boolean ocd;
        private boolean violent;
        private boolean depression;
        private boolean relationship;
        private boolean generalizedWorry;
        private boolean sadness;
        private boolean anxiety;
        private boolean sleep;
        private int indicatorHits;
        private int level;

        static Signals read(String text, List<String> recentHistory) {
            Signals s = new Signals();
            s.normalized = KeywordLexicon.normalize(text);
            String t = s.normalized;

            s.crisisKeyword = KeywordLexicon.CRISIS.matches(t);
            s.psychosis = KeywordLexicon.PSYCHOSIS.matches(t);
            s.panic = KeywordLexicon.PANIC.matches(t);
            s.trauma = KeywordLexicon.TRAUMA.matches(t);
            s.ocd = KeywordLexicon.OCD.matches(t);
            s.violent = s.crisisKeyword || KeywordLexicon.VIOLENT.matches(t);
            s.depression = KeywordLexicon.DEPRESSION.matches(t);
            s.relationship = KeywordLexicon.RELATIONSHIP.matches(t);
            s.generalizedWorry = KeywordLexicon.GENERALIZED_WORRY.matches(t);
            s.sadness = KeywordLexicon.SADNESS.matches(t);
            s.anxiety = KeywordLexicon.ANXIETY.matches(t);
            s.sleep = KeywordLexicon.SLEEP.matches(t);
            s.indicatorHits = KeywordLexicon.ANXIETY_INDICATORS.countHits(t);

            int level = Math.min(BASE_LEVEL + s.indicatorHits * 2, Assessment.MAX_LEVEL);
            if (historyShowsDistress(recentHistory)) {
                level = Math.min(level + 1, Assessment.MAX_LEVEL);
            }
            if (KeywordLexicon.PANIC_ESCALATORS.matches(t)) {
                level = Math.max(level, 7);
            }
            if (s.psychosis) {
                level = Assessment.MAX_LEVEL;
            } else if (s.violent) {
                level = Math.max(level, 8);
            } else if (s.depression) {
                level = Math.max(level, 6);
            }
            s.level = level;
            return s;
        }

        private static boolean historyShowsDistress(List<String> recentHistory) {
            if (recentHistory == null || recentHistory.isEmpty()) {
                return false;
            }
            List<String> tail = new ArrayList<>(recentHistory.subList(
                    Math.max(0, recentHistory.size() - HISTORY_LOOKBACK), recentHistory.size()));
            return tail.stream()
                    .map(KeywordLexicon::normalize)
                    .anyMatch(h -> KeywordLexicon.ANXIETY_INDICATORS.matches(h)
                            || KeywordLexicon.DEPRESSION.matches(h)
                            || KeywordLexicon.hasCrisisSignal(h));
        }
    }
}
