package com.astroplatform.common.extractor;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based birth details extractor (the fast path).
 *
 * <p>Runs three pattern cascades over the message, first match wins in each:
 * <ul>
 *   <li>date: {@code YYYY-MM-DD}, {@code DD/MM/YYYY} or {@code DD-MM-YYYY},
 *       {@code DD.MM.YYYY}, {@code DD Mon YYYY} (+{@value #DATE_WEIGHT})</li>
 *   <li>time: {@code HH:MM[am|pm]}, {@code H am|pm}, {@code HH.MM}
 *       (+{@value #TIME_WEIGHT})</li>
 *   <li>location: "born in / in / at / from &lt;Capitalised Place&gt;"
 *       (+{@value #LOCATION_WEIGHT}), else the first alphabetic comma-separated segment
 *       after the date and time (+{@value #TRAILING_LOCATION_WEIGHT})</li>
 * </ul>
 * The matched date and time spans are blanked before the next cascade runs so a date
 * such as {@code 10.10.1985} is never read back as a time.
 *
 * <p>A time without meridiem outside 00:00 to 23:59, or a meridiem hour outside 1 to 12,
 * is rejected rather than guessed. An impossible calendar date is rejected the same way.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class BirthDetailsExtractor {

    public static final double DATE_WEIGHT              = 0.4;
    public static final double TIME_WEIGHT              = 0.3;
    public static final double LOCATION_WEIGHT          = 0.3;
    public static final double TRAILING_LOCATION_WEIGHT = 0.2;

    /** Minimum confidence for a complete candidate to be accepted without a second opinion. */
    public static final double ACCEPTANCE_THRESHOLD = 0.7;

    private static final Pattern ISO_DATE     = Pattern.compile("\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b");
    private static final Pattern DMY_DATE     = Pattern.compile("\\b(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})\\b");
    private static final Pattern DOTTED_DATE  = Pattern.compile("\\b(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})\\b");
    private static final Pattern NAMED_DATE   = Pattern.compile(
        "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*,?\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOCK_TIME    = Pattern.compile(
        "\\b(\\d{1,2}):(\\d{2})(?:\\s*(am|pm|a\\.m\\.|p\\.m\\.)(?![a-z]))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern MERIDIEM_TIME = Pattern.compile(
        "\\b(\\d{1,2})\\s*(am|pm|a\\.m\\.|p\\.m\\.)(?![a-z])", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOTTED_TIME   = Pattern.compile("\\b(\\d{1,2})\\.(\\d{2})\\b");

    private static final Pattern PREPOSITION_LOCATION = Pattern.compile(
        "\\b(?:born\\s+in|in|at|from)\\s+([A-Z][a-zA-Z]+(?:[ \\t]*,?[ \\t]*[A-Z][a-zA-Z]+)*)");
    private static final Pattern PLACE_SEGMENT = Pattern.compile("[A-Za-z][A-Za-z .'-]*");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private BirthDetailsExtractor() {}

    /**
     * @param text free text from the user
     * @return a candidate when at least one field was found; empty otherwise
     */
    public static Optional<BirthDetailsCandidate> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        double confidence = 0.0;
        StringBuilder remaining = new StringBuilder(text);

        // ── date ─────────────────────────────────────────────────────────
        LocalDate date = extractDate(remaining);
        if (date != null) confidence += DATE_WEIGHT;

        // ── time ─────────────────────────────────────────────────────────
        String time = extractTime(remaining);
        if (time != null) confidence += TIME_WEIGHT;

        // ── location ─────────────────────────────────────────────────────
        String location = prepositionLocation(remaining.toString());
        if (location != null) {
            confidence += LOCATION_WEIGHT;
        } else {
            location = trailingSegmentLocation(text);
            if (location != null) confidence += TRAILING_LOCATION_WEIGHT;
        }

        if (date == null && time == null && location == null) {
            return Optional.empty();
        }
        return Optional.of(new BirthDetailsCandidate(
            date, time, location, null,
            Math.min(1.0, confidence),
            BirthDetailsCandidate.Source.RULES));
    }

    // ── date cascade ───────────────────────────────────────────────────────

    private static LocalDate extractDate(StringBuilder text) {
        Matcher m = ISO_DATE.matcher(text);
        if (m.find()) {
            LocalDate d = date(m.group(1), m.group(2), m.group(3));
            if (d != null) return consume(text, m, d);
        }
        for (Pattern p : List.of(DMY_DATE, DOTTED_DATE)) {
            m = p.matcher(text);
            if (m.find()) {
                LocalDate d = date(m.group(3), m.group(2), m.group(1));
                if (d != null) return consume(text, m, d);
            }
        }
        m = NAMED_DATE.matcher(text);
        if (m.find()) {
            Integer month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
            LocalDate d = date(m.group(3), String.valueOf(month), m.group(1));
            if (d != null) return consume(text, m, d);
        }
        return null;
    }

    private static LocalDate date(String year, String month, String day) {
        int y = Integer.parseInt(year);
        int mo = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        if (mo < 1 || mo > 12 || d < 1) return null;
        if (d > YearMonth.of(y, mo).lengthOfMonth()) return null;
        return LocalDate.of(y, mo, d);
    }

    // ── time cascade ───────────────────────────────────────────────────────

    private static String extractTime(StringBuilder text) {
        Matcher m = CLOCK_TIME.matcher(text);
        if (m.find()) {
            String t = time(m.group(1), m.group(2), m.group(3));
            if (t != null) return consume(text, m, t);
        }
        m = MERIDIEM_TIME.matcher(text);
        if (m.find()) {
            String t = time(m.group(1), "0", m.group(2));
            if (t != null) return consume(text, m, t);
        }
        m = DOTTED_TIME.matcher(text);
        if (m.find()) {
            String t = time(m.group(1), m.group(2), null);
            if (t != null) return consume(text, m, t);
        }
        return null;
    }

    /** Normalizes to {@code HH:mm}; null when the clock reading is impossible. */
    static String time(String hourText, String minuteText, String meridiem) {
        int hour = Integer.parseInt(hourText);
        int minute = Integer.parseInt(minuteText);
        if (minute > 59) return null;

        if (meridiem == null) {
            if (hour > 23) return null;
        } else {
            if (hour < 1 || hour > 12) return null;
            boolean pm = meridiem.toLowerCase(Locale.ROOT).startsWith("p");
            if (pm && hour != 12) hour += 12;
            else if (!pm && hour == 12) hour = 0;
        }
        return String.format("%02d:%02d", hour, minute);
    }

    // ── location cascade ───────────────────────────────────────────────────

    private static String prepositionLocation(String text) {
        Matcher m = PREPOSITION_LOCATION.matcher(text);
        while (m.find()) {
            String place = clean(m.group(1));
            if (place.length() > 2) {
                return place;
            }
        }
        return null;
    }

    /**
     * "Name, 10-10-1985, 10:47am, Dehradun": the place is the first purely alphabetic
     * segment after the last segment that carries digits.
     */
    private static String trailingSegmentLocation(String text) {
        String[] segments = text.split("[,;\\n]");
        int lastNumeric = -1;
        for (int i = 0; i < segments.length; i++) {
            if (segments[i].chars().anyMatch(Character::isDigit)) {
                lastNumeric = i;
            }
        }
        if (lastNumeric < 0) {
            return null;
        }
        for (int i = lastNumeric + 1; i < segments.length; i++) {
            String seg = segments[i].trim();
            if (PLACE_SEGMENT.matcher(seg).matches() && Character.isUpperCase(seg.charAt(0))) {
                String place = clean(seg);
                if (place.length() > 2) {
                    return place;
                }
            }
        }
        return null;
    }

    private static String clean(String raw) {
        String s = raw.trim();
        while (!s.isEmpty() && (s.endsWith(",") || s.endsWith("."))) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** Blanks the matched span so later cascades cannot re-read it. */
    private static <T> T consume(StringBuilder text, Matcher m, T value) {
        for (int i = m.start(); i < m.end(); i++) {
            text.setCharAt(i, ' ');
        }
        return value;
    }
}
