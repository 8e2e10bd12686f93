package com.buildrunner.core.output;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns captured text into the lines shown to the user.
 *
 * <p>Lines are split on {@code \r?\n} and right-trimmed. Trailing blank lines are dropped,
 * leading ones are kept. Abridged output keeps the first {@value #HEAD_LINES} and last
 * {@value #TAIL_LINES} lines around a single omission marker.
 */
public final class OutputAbridger {

    public static final int MAX_LINES = 10;
    public static final int HEAD_LINES = 5;
    public static final int TAIL_LINES = 5;

    private OutputAbridger() {}

    public static List<String> trimmedLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var lines = new ArrayList<String>();
        for (String line : text.split("\\r?\\n", -1)) {
            lines.add(line.stripTrailing());
        }
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isEmpty()) {
            end--;
        }
        return List.copyOf(lines.subList(0, end));
    }

    public static List<String> abridge(String text) {
        List<String> lines = trimmedLines(text);
        if (lines.size() <= MAX_LINES) {
            return lines;
        }
        int omitted = lines.size() - HEAD_LINES - TAIL_LINES;
        var abridged = new ArrayList<String>(HEAD_LINES + TAIL_LINES + 1);
        abridged.addAll(lines.subList(0, HEAD_LINES));
        abridged.add(omissionMarker(omitted));
        abridged.addAll(lines.subList(lines.size() - TAIL_LINES, lines.size()));
        return abridged;
    }

    static String omissionMarker(int omitted) {
        return "... " + omitted + (omitted == 1 ? " line" : " lines") + " omitted ...";
    }
}
