package com.virtualcommittee.committee.evaluator;

/**
 * Ranked catalyst taxonomy.
 *
 * <p>Declaration order is the match order: a catalyst type string is tested
 * against each {@link #pattern()} as a substring, top to bottom, and the first
 * hit wins. More specific patterns therefore sit above the generic ones they
 * contain ({@code earnings_beat_history} before {@code earnings},
 * {@code m&a_rumor} before {@code rumor}).
 */
public enum CatalystType {
    FDA_DECISION("fda_decision", 8),
    FDA_APPROVAL("fda_approval", 8),
    FDA("fda", 8),
    EARNINGS_BEAT_HISTORY("earnings_beat_history", 8),
    MA_RUMOR("m&a_rumor", 7),
    MA("m&a", 7),
    MERGER("merger", 7),
    ACQUISITION("acquisition", 7),
    EARNINGS("earnings", 6),
    PRODUCT_LAUNCH("product_launch", 6),
    INVESTOR_DAY("investor_day", 5),
    CONFERENCE("conference", 4),
    MACRO_EVENT("macro_event", 4),
    ANALYST_UPGRADE("analyst_upgrade", 5),
    BUYBACK("buyback", 5),
    RUMOR("rumor", 2),
    SPECULATION("speculation", 2),
    UNKNOWN("unknown", 2);

    /** Points for a type string that matches no pattern. */
    public static final int UNMATCHED_POINTS = 2;

    private final String pattern;
    private final int points;

    CatalystType(String pattern, int points) {
        this.pattern = pattern;
        this.points = points;
    }

    public String pattern() { return pattern; }

    public int points() { return points; }

    /**
     * @param normalizedType lower-cased catalyst type
     * @return first matching entry, or {@code null} when nothing matches
     */
    public static CatalystType match(String normalizedType) {
        for (CatalystType type : values()) {
            if (normalizedType.contains(type.pattern)) return type;
        }
        return null;
    }
}
