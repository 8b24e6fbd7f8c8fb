package com.anxietycompanion.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword tables shared by the classifier, the orchestrator and the escalation gate.
 * Matching runs on {@link #normalize(String) normalized} text and only fires on whole
 * words or phrases, so "war" never matches inside "aware".
 */
public final class KeywordLexicon {

    public static final KeywordSet CRISIS = KeywordSet.of(
            "suicide", "suicidal", "kill myself", "killing myself", "hurt myself", "hurting myself",
            "end it all", "end my life", "want to die", "better off dead", "not worth living",
            "no reason to live", "self harm", "self-harm", "cut myself",
            "suicidio", "matarme", "quiero morir", "hacerme daño");

    public static final KeywordSet PSYCHOSIS = KeywordSet.of(
            "seeing things", "hearing voices", "hearing things", "voices in my head", "watching me",
            "following me", "spying on me", "spies", "conspiracy", "after me", "dogs talking",
            "dogs are talking", "cats talking", "animals talking", "objects talking", "things moving",
            "hallucination", "hallucinating", "paranoid", "delusion",
            "escucho voces", "oigo voces");

    public static final KeywordSet PANIC = KeywordSet.of(
            "panic", "panicking", "panic attack", "heart racing", "heart is racing", "can't breathe",
            "cannot breathe", "chest pain", "dying", "losing control",
            "pánico", "ataque de pánico", "no puedo respirar");

    public static final KeywordSet TRAUMA = KeywordSet.of(
            "trauma", "traumatic", "flashback", "flashbacks", "nightmare", "nightmares", "trigger",
            "triggered", "ptsd", "veteran", "assault", "assaulted", "accident");

    public static final KeywordSet OCD = KeywordSet.of(
            "ocd", "obsessive", "compulsive", "compulsion", "compulsions", "contamination", "checking",
            "counting", "intrusive", "ritual", "rituals");

    public static final KeywordSet VIOLENT = KeywordSet.of(
            "hurt", "hurting", "kill", "killing", "die");

    public static final KeywordSet DEPRESSION = KeywordSet.of(
            "depressed", "sad", "hopeless", "depression",
            "triste", "deprimido", "deprimida", "depresión");

    public static final KeywordSet RELATIONSHIP = KeywordSet.of(
            "wife", "husband", "partner", "girlfriend", "boyfriend", "cheat", "cheated", "cheating");

    public static final KeywordSet GENERALIZED_WORRY = KeywordSet.of(
            "generalized anxiety", "gad", "worry about everything");

    public static final KeywordSet SADNESS = KeywordSet.of(
            "sad", "sadness", "depression", "depressed", "hopeless",
            "triste", "tristeza", "deprimido", "deprimida", "depresión");

    public static final KeywordSet ANXIETY = KeywordSet.of(
            "anxious", "anxiety", "worried",
            "ansiedad", "ansioso", "ansiosa", "preocupado", "preocupada");

    public static final KeywordSet SLEEP = KeywordSet.of(
            "can't sleep", "cannot sleep", "insomnia", "no puedo dormir", "insomnio");

    /** Counted, not just matched: each hit raises the base level. */
    public static final KeywordSet ANXIETY_INDICATORS = KeywordSet.of(
            "anxious", "worry", "worried", "stress", "stressed", "panic", "fear", "scared", "overwhelmed",
            "nervous", "tense", "restless", "uneasy", "troubled", "disturbed",
            "ansiedad", "estrés", "miedo", "nervioso", "nerviosa");

    public static final KeywordSet PANIC_ESCALATORS = KeywordSet.of("panic", "overwhelming");

    public static final Map<String, KeywordSet> TRIGGER_CATEGORIES;
    public static final Map<String, KeywordSet> COGNITIVE_DISTORTIONS;

    static {
        Map<String, KeywordSet> triggers = new LinkedHashMap<>();
        triggers.put("driving", KeywordSet.of("driving", "drive", "car", "vehicle", "intersection", "traffic",
                "road", "highway", "freeway", "lane", "parking", "crash", "accident", "collision"));
        triggers.put("work", KeywordSet.of("work", "job", "office", "boss", "colleague", "career", "workplace",
                "employment", "meeting", "deadline"));
        triggers.put("social", KeywordSet.of("social", "people", "friends", "party", "gathering", "conversation",
                "public", "crowd", "speaking", "presentation"));
        triggers.put("health", KeywordSet.of("health", "sick", "pain", "doctor", "hospital", "illness", "disease",
                "symptom", "symptoms", "medical", "therapy"));
        triggers.put("financial", KeywordSet.of("money", "financial", "debt", "bills", "budget", "income",
                "expenses", "payment", "loan", "mortgage"));
        triggers.put("relationships", KeywordSet.of("relationship", "partner", "spouse", "divorce", "breakup",
                "dating", "marriage", "family", "conflict"));
        triggers.put("performance", KeywordSet.of("test", "exam", "performance", "evaluation", "assessment",
                "interview", "competition", "failure", "success"));
        triggers.put("future-uncertainty", KeywordSet.of("future", "unknown", "uncertain", "change", "decision",
                "choice", "plan", "tomorrow", "later"));
        TRIGGER_CATEGORIES = Collections.unmodifiableMap(triggers);

        Map<String, KeywordSet> distortions = new LinkedHashMap<>();
        distortions.put("All-or-nothing thinking", KeywordSet.of("always", "never", "everything"));
        distortions.put("Should statements", KeywordSet.of("should", "must", "have to"));
        distortions.put("Catastrophizing", KeywordSet.of("worst", "terrible", "awful"));
        COGNITIVE_DISTORTIONS = Collections.unmodifiableMap(distortions);
    }

    private KeywordLexicon() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .trim();
    }

    /**
     * Explicit self-harm language or psychosis indicators.
     */
    public static boolean hasCrisisSignal(String normalized) {
        return CRISIS.matches(normalized) || PSYCHOSIS.matches(normalized);
    }

    public static List<String> detectTriggerCategories(String normalized) {
        return matchingLabels(TRIGGER_CATEGORIES, normalized);
    }

    public static List<String> detectCognitiveDistortions(String normalized) {
        return matchingLabels(COGNITIVE_DISTORTIONS, normalized);
    }

    private static List<String> matchingLabels(Map<String, KeywordSet> table, String normalized) {
        return table.entrySet().stream()
                .filter(entry -> entry.getValue().matches(normalized))
                .map(Map.Entry::getKey)
                .toList();
    }

    public static final class KeywordSet {

        private final List<Pattern> patterns;

        private KeywordSet(List<String> keywords) {
            this.patterns = keywords.stream()
                    .map(KeywordSet::wholeWord)
                    .toList();
        }

        public static KeywordSet of(String... keywords) {
            return new KeywordSet(List.of(keywords));
        }

        private static Pattern wholeWord(String keyword) {
            return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword) + "(?![\\p{L}\\p{N}])");
        }

        public boolean matches(String normalized) {
            return patterns.stream().anyMatch(p -> p.matcher(normalized).find());
        }

        /** Number of distinct keywords present. */
        public int countHits(String normalized) {
            return (int) patterns.stream()
                    .filter(p -> p.matcher(normalized).find())
                    .count();
        }
    }
}
