package com.astroplatform.conversation.generator;

import com.astroplatform.common.model.GeneratorReply;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the SUMMARY / REASONS / REMEDIES layout requested by {@link ReadingPromptBuilder}.
 *
 * <p>Section headers are matched case-insensitively at the start of a line (leading
 * markdown {@code #} and {@code *} ignored). Text before any header counts as summary.
 * List markers are stripped from bullets; bullets of {@value #MIN_ITEM_LENGTH}
 * characters or fewer are dropped.
 *
 * No Spring dependency. No I/O. Pure function.
 */
public final class ReplyParser {

    static final int MAX_REASONS        = 4;
    static final int MAX_REMEDIES       = 2;
    static final int MIN_ITEM_LENGTH    = 10;
    static final int SUMMARY_FALLBACK   = 300;
    static final String DEFAULT_REASON  = "Based on your chart analysis";

    private static final String BULLET_CHARS = "-•*0123456789.) ";

    private enum Section { NONE, SUMMARY, REASONS, REMEDIES }

    private ReplyParser() {}

    public static GeneratorReply parse(String text) {
        String raw = text == null ? "" : text;
        StringBuilder summary = new StringBuilder();
        List<String> reasons  = new ArrayList<>();
        List<String> remedies = new ArrayList<>();
        Section section = Section.NONE;

        for (String rawLine : raw.strip().split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) continue;

            Section header = header(line);
            if (header != null) {
                section = header;
                if (header == Section.SUMMARY) {
                    appendTo(summary, line.substring(line.indexOf(':') + 1).replaceFirst("^[*#\\s]+", "").strip());
                }
                continue;
            }

            switch (section) {
                case NONE, SUMMARY -> appendTo(summary, line);
                case REASONS       -> addItem(reasons, line);
                case REMEDIES      -> addItem(remedies, line);
            }
        }

        String finalSummary = summary.length() > 0
            ? summary.toString()
            : raw.substring(0, Math.min(SUMMARY_FALLBACK, raw.length())).strip();
        List<String> finalReasons = reasons.isEmpty()
            ? List.of(DEFAULT_REASON)
            : reasons.subList(0, Math.min(MAX_REASONS, reasons.size()));

        return new GeneratorReply(raw, finalSummary, finalReasons,
            remedies.subList(0, Math.min(MAX_REMEDIES, remedies.size())));
    }

    private static Section header(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) return null;
        String label = line.substring(0, colon).replaceAll("[#*]", "").strip().toLowerCase();
        if (label.startsWith("summary"))  return Section.SUMMARY;
        if (label.startsWith("reason"))   return Section.REASONS;
        if (label.startsWith("remed"))    return Section.REMEDIES;
        return null;
    }

    private static void appendTo(StringBuilder summary, String text) {
        if (text.isEmpty()) return;
        if (summary.length() > 0) summary.append(' ');
        summary.append(text);
    }

    private static void addItem(List<String> items, String line) {
        int start = 0;
        while (start < line.length() && BULLET_CHARS.indexOf(line.charAt(start)) >= 0) {
            start++;
        }
        String clean = line.substring(start).strip();
        if (clean.length() > MIN_ITEM_LENGTH) {
            items.add(clean);
        }
    }
}
