package com.astroplatform.common.classifier;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure stateless classifier that maps a question to a {@link TimeframeResult}.
 *
 * <p>Rules are evaluated most specific first and the first match wins:
 * <ol>
 *   <li>day and week phrases ("this week", "next 3 weeks", "next 10 days", "today")</li>
 *   <li>month phrases ("this month", "next 3 months", "few months")</li>
 *   <li>year phrases ("next year", "next 2 years", "few years")</li>
 *   <li>"long term"</li>
 * </ol>
 * Numeric captures are normalized with 1 day = 1/30 month and 1 week = 7/30 month
 * (both rounded to one decimal) and
 * 1 year = 12 months. No match yields the 12-month default.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class TimeframeClassifier {

    private record Rule(Pattern pattern, TimeframeType type, Integer value, Double horizonMonths) {

        static Rule fixed(String regex, TimeframeType type, int value, double horizon) {
            return new Rule(Pattern.compile(regex), type, value, horizon);
        }

        static Rule numeric(String regex, TimeframeType type) {
            return new Rule(Pattern.compile(regex), type, null, null);
        }

        boolean isNumeric() {
            return value == null;
        }
    }

    private static final List<Rule> RULES = List.of(
        // days / weeks
        Rule.fixed("\\b(this|next)\\s+week\\b",                  TimeframeType.WEEKS, 1, 0.25),
        Rule.numeric("\\b(next|coming)\\s+(\\d{1,4})\\s+weeks?\\b",  TimeframeType.WEEKS),
        Rule.numeric("\\b(next|coming)\\s+(\\d{1,4})\\s+days?\\b",   TimeframeType.DAYS),
        Rule.fixed("\\b(today|now|immediate|urgent)\\b",         TimeframeType.DAYS, 7, 0.25),
        // months
        Rule.fixed("\\b(this|current)\\s+month\\b",              TimeframeType.MONTHS, 1, 1),
        Rule.fixed("\\b(next|coming)\\s+month\\b",               TimeframeType.MONTHS, 1, 1),
        Rule.numeric("\\b(next|coming)\\s+(\\d{1,4})\\s+months?\\b", TimeframeType.MONTHS),
        Rule.fixed("\\b(next\\s+)?few\\s+months\\b",             TimeframeType.MONTHS, 3, 3),
        Rule.fixed("\\b(next\\s+)?several\\s+months\\b",         TimeframeType.MONTHS, 6, 6),
        // years
        Rule.fixed("\\b(this|current)\\s+year\\b",               TimeframeType.YEARS, 1, 12),
        Rule.fixed("\\b(next|coming)\\s+year\\b",                TimeframeType.YEARS, 1, 12),
        Rule.numeric("\\b(next|coming)\\s+(\\d{1,4})(-|\\s+to\\s+)?(\\d{1,4})?\\s+years?\\b", TimeframeType.YEARS),
        Rule.fixed("\\b(next\\s+)?few\\s+years\\b",              TimeframeType.YEARS, 2, 24),
        Rule.fixed("\\blong\\s+term\\b",                         TimeframeType.YEARS, 5, 60)
    );

    private TimeframeClassifier() {}

    /**
     * @param text raw question; null or blank yields the default horizon
     * @return classified timeframe; never null
     */
    public static TimeframeResult classify(String text) {
        if (text == null || text.isBlank()) {
            return TimeframeResult.defaultHorizon();
        }
        String lower = text.toLowerCase();

        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(lower);
            if (!m.find()) {
                continue;
            }
            if (!rule.isNumeric()) {
                return TimeframeResult.of(rule.type(), rule.value(), rule.horizonMonths());
            }
            Integer n = firstNumber(m);
            if (n != null && n > 0) {
                return TimeframeResult.of(rule.type(), n, toMonths(rule.type(), n));
            }
        }
        return TimeframeResult.defaultHorizon();
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Integer firstNumber(Matcher m) {
        for (int g = 1; g <= m.groupCount(); g++) {
            String group = m.group(g);
            if (group != null && !group.isEmpty() && group.chars().allMatch(Character::isDigit)) {
                return Integer.parseInt(group);
            }
        }
        return null;
    }

    private static double toMonths(TimeframeType type, int n) {
        return switch (type) {
            case DAYS   -> Math.round(n / (double) TimeframeResult.DAYS_PER_MONTH * 10) / 10.0;
            case WEEKS  -> Math.round(n * 7 / (double) TimeframeResult.DAYS_PER_MONTH * 10) / 10.0;
            case MONTHS -> n;
            case YEARS  -> n * 12.0;
            default     -> TimeframeResult.DEFAULT_HORIZON_MONTHS;
        };
    }
}
