package io.memento.scoring;

import io.memento.memory.Memory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Relevance scoring for a single memory.
 *
 * <p>Combined score = keyword * recency * accessBoost * lastAccessRecency</p>
 * <ul>
 *   <li>keyword (0-1): fraction of query terms found in content + tags; zero short-circuits to 0</li>
 *   <li>recency (0-1): exponential decay of age with a 7-day half-life</li>
 *   <li>accessBoost (1.0-2.0): log2 lift from the access count</li>
 *   <li>lastAccessRecency (1.0-1.5): temporary boost for memories retrieved in the last ~48h</li>
 * </ul>
 *
 * <p>All functions are pure. Missing timestamps, tags and counts resolve to neutral values.</p>
 */
public final class ScoringEngine {

    public static final double HALF_LIFE_HOURS = 168;
    public static final double LAST_ACCESS_HALF_LIFE_HOURS = 48;
    public static final double MAX_ACCESS_BOOST = 2.0;
    public static final double MAX_LAST_ACCESS_BOOST = 1.5;

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private ScoringEngine() {
    }

    /**
     * Scores a memory against lowercase query terms.
     *
     * <p>With no query terms the keyword factor is skipped entirely; the decay job relies on this
     * to compute stored relevance.</p>
     *
     * @param memory     the memory to score
     * @param queryTerms lowercase query terms, may be empty
     * @param now        reference time
     * @return score, 0 when no term matches
     */
    public static double scoreMemory(Memory memory, List<String> queryTerms, Instant now) {
        if (queryTerms == null || queryTerms.isEmpty()) {
            return recency(memory.createdAt(), now)
                    * accessBoost(memory.accessCount())
                    * lastAccessRecency(memory.lastAccessedAt(), now);
        }

        double keyword = keywordScore(memory, queryTerms);
        if (keyword == 0) return 0;

        return keyword
                * recency(memory.createdAt(), now)
                * accessBoost(memory.accessCount())
                * lastAccessRecency(memory.lastAccessedAt(), now);
    }

    /**
     * Fraction of query terms occurring as substrings of the lowercased content and tags.
     */
    public static double keywordScore(Memory memory, List<String> queryTerms) {
        if (queryTerms == null || queryTerms.isEmpty()) return 0;
        String searchable = memory.content().toLowerCase(Locale.ROOT) + " " + String.join(" ", memory.tags());

        long hits = queryTerms.stream().filter(searchable::contains).count();
        return (double) hits / queryTerms.size();
    }

    /**
     * Exponential decay with a 7-day half-life; 1.0 for a missing or future creation time.
     */
    public static double recency(Instant createdAt, Instant now) {
        return decayFactor(createdAt, now, HALF_LIFE_HOURS);
    }

    /**
     * {@code 0.5 ^ (ageHours / halfLifeHours)}, or 1.0 when the age is unknown or not positive.
     */
    public static double decayFactor(Instant createdAt, Instant now, double halfLifeHours) {
        if (createdAt == null || now == null) return 1.0;
        double ageHours = hoursBetween(createdAt, now);
        if (ageHours <= 0) return 1.0;
        return Math.pow(0.5, ageHours / halfLifeHours);
    }

    /**
     * {@code min(2.0, 1 + log2(1 + count) * 0.3)}.
     */
    public static double accessBoost(int accessCount) {
        int count = Math.max(0, accessCount);
        double log2 = Math.log(1 + count) / Math.log(2);
        return Math.min(MAX_ACCESS_BOOST, 1 + log2 * 0.3);
    }

    /**
     * {@code 1 + 0.5 * 0.5 ^ (hoursSince / 48)}: 1.5 right after an access, falling toward 1.0.
     * 1.0 when never accessed; clamped to 1.5 for an access time after {@code now}.
     */
    public static double lastAccessRecency(Instant lastAccessedAt, Instant now) {
        if (lastAccessedAt == null || now == null) return 1.0;
        double hoursSince = hoursBetween(lastAccessedAt, now);
        if (hoursSince < 0) return MAX_LAST_ACCESS_BOOST;
        return 1 + 0.5 * Math.pow(0.5, hoursSince / LAST_ACCESS_HALF_LIFE_HOURS);
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
