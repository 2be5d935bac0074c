package com.astroplatform.common.taxonomy;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Keyword sets per topic. Entries containing a space are phrases and are matched
 * as substrings of the lower-cased message; all others are matched as whole words.
 */
public final class TopicKeywords {

    private static final Map<Topic, Set<String>> KEYWORDS = new EnumMap<>(Topic.class);

    static {
        KEYWORDS.put(Topic.CAREER, Set.of(
            "job", "career", "work", "office", "boss", "promotion", "startup",
            "company", "profession", "employment", "colleague", "interview",
            "resign", "fired", "hired", "workplace", "business", "venture",
            "entrepreneur", "corporate", "salary hike", "appraisal", "project"));
        KEYWORDS.put(Topic.ROMANTIC_RELATIONSHIPS, Set.of(
            "love", "crush", "dating", "boyfriend", "girlfriend", "romantic",
            "attraction", "relationship", "romance", "flirt", "breakup",
            "ex", "feelings", "chemistry", "soulmate", "twin flame"));
        KEYWORDS.put(Topic.MARRIAGE_PARTNERSHIP, Set.of(
            "marriage", "husband", "wife", "spouse", "wedding", "married",
            "divorce", "engagement", "partner", "matrimony", "manglik",
            "compatibility", "kundli matching", "vivah", "shaadi"));
        KEYWORDS.put(Topic.MONEY, Set.of(
            "money", "income", "salary", "finance", "investment", "debt",
            "loan", "wealth", "rich", "poor", "savings", "stock", "trading",
            "real estate", "property", "inheritance", "financial", "profit",
            "loss", "expense", "budget", "crypto", "mutual fund"));
        KEYWORDS.put(Topic.FAMILY_HOME, Set.of(
            "family", "mother", "father", "parents", "home", "house",
            "children", "kids", "son", "daughter", "sibling", "brother",
            "sister", "relatives", "in-laws", "ancestral", "property",
            "domestic", "household"));
        KEYWORDS.put(Topic.FRIENDS_SOCIAL, Set.of(
            "friend", "friends", "social", "party", "networking", "group",
            "community", "circle", "connections", "acquaintance", "peers"));
        KEYWORDS.put(Topic.LEARNING_EDUCATION, Set.of(
            "study", "exam", "college", "university", "course", "degree",
            "learning", "skill", "education", "school", "student", "teacher",
            "training", "certification", "academic", "research", "phd",
            "masters", "bachelors", "competitive exam", "upsc", "cat", "gmat"));
        KEYWORDS.put(Topic.HEALTH_ENERGY, Set.of(
            "health", "tired", "energy", "fitness", "diet", "stress",
            "sleep", "illness", "disease", "doctor", "hospital", "medicine",
            "surgery", "mental", "anxiety", "depression", "wellness",
            "fatigue", "chronic", "recovery"));
        KEYWORDS.put(Topic.SPIRITUALITY, Set.of(
            "spiritual", "meditation", "karma", "purpose", "soul", "inner",
            "enlightenment", "guru", "temple", "prayer", "mantra", "moksha",
            "dharma", "divine", "consciousness", "awakening", "past life",
            "astral", "intuition"));
        KEYWORDS.put(Topic.TRAVEL_RELOCATION, Set.of(
            "travel", "trip", "abroad", "relocate", "move", "foreign",
            "immigration", "visa", "overseas", "settle", "migration",
            "country", "city", "shifting", "transfer"));
        KEYWORDS.put(Topic.LEGAL_CONTRACTS, Set.of(
            "court", "legal", "contract", "case", "lawsuit", "lawyer",
            "litigation", "dispute", "agreement", "settlement", "judge",
            "police", "crime"));
        KEYWORDS.put(Topic.SELF_PSYCHOLOGY, Set.of(
            "personality", "character", "nature", "myself", "identity",
            "confidence", "self-esteem", "who am i", "purpose", "life path",
            "destiny", "potential", "strengths", "weaknesses"));
        KEYWORDS.put(Topic.DAILY_GUIDANCE, Set.of(
            "today", "daily", "now", "this week", "this month", "guidance",
            "current", "immediate", "right now", "tomorrow"));
    }

    private TopicKeywords() {}

    /** Keyword set for {@code topic}; empty for {@link Topic#GENERAL}. */
    public static Set<String> forTopic(Topic topic) {
        return KEYWORDS.getOrDefault(topic, Set.of());
    }
}
