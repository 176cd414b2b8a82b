package com.gsdorchestrator.state;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented helpers shared by the planning document parsers.
 */
final class MarkdownSections {

    private static final Pattern H2 = Pattern.compile("^##\\s+.*");
    private static final Pattern H2_OR_H3 = Pattern.compile("^#{2,3}\\s+.*");
    private static final Pattern BULLET = Pattern.compile("^[-*]\\s+(.*)$");
    private static final Pattern NONE = Pattern.compile("^None\\.?\\s*$", Pattern.CASE_INSENSITIVE);

    private MarkdownSections() {
    }

    static boolean isBlank(String content) {
        return content == null || content.trim().isEmpty();
    }

    static List<String> lines(String content) {
        return List.of(content.replace("\r\n", "\n").split("\n", -1));
    }

    /**
     * Trimmed lines of the {@code ## <title>} section, up to the next {@code ##} heading, or null when the
     * heading is absent. {@code title} is matched as a prefix on a word boundary.
     */
    static List<String> level2Section(List<String> lines, String title) {
        return section(lines, Pattern.compile("^##\\s+" + Pattern.quote(title) + "\\b.*"), H2);
    }

    /**
     * Same as {@link #level2Section} for a {@code ### <title>} section, which also ends at a {@code ##}.
     */
    static List<String> level3Section(List<String> lines, String title) {
        return section(lines, Pattern.compile("^###\\s+" + Pattern.quote(title) + "(?:\\b|$).*"), H2_OR_H3);
    }

    private static List<String> section(List<String> lines, Pattern start, Pattern end) {
        List<String> body = null;
        for (String line : lines) {
            String trimmed = line.trim();
            if (body == null) {
                if (start.matcher(trimmed).matches()) {
                    body = new ArrayList<>();
                }
                continue;
            }
            if (end.matcher(trimmed).matches()) {
                break;
            }
            body.add(trimmed);
        }
        return body;
    }

    /**
     * Bullet items of a section; a lone "None." line contributes nothing.
     */
    static List<String> bullets(List<String> sectionLines) {
        List<String> items = new ArrayList<>();
        if (sectionLines == null) {
            return items;
        }
        for (String line : sectionLines) {
            if (NONE.matcher(line).matches()) {
                continue;
            }
            Matcher m = BULLET.matcher(line);
            if (m.matches()) {
                String item = m.group(1).trim();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    /**
     * First run of contiguous non-blank lines, joined with single spaces.
     */
    static String firstParagraph(List<String> sectionLines) {
        if (sectionLines == null) {
            return null;
        }
        StringBuilder paragraph = new StringBuilder();
        for (String line : sectionLines) {
            if (line.isEmpty()) {
                if (paragraph.length() > 0) {
                    break;
                }
                continue;
            }
            if (paragraph.length() > 0) {
                paragraph.append(' ');
            }
            paragraph.append(line);
        }
        return paragraph.length() > 0 ? paragraph.toString() : null;
    }

    /**
     * Value after {@code label:} when the line starts with it, otherwise null.
     */
    static String labelled(String line, String label) {
        String prefix = label + ":";
        if (!line.startsWith(prefix)) {
            return null;
        }
        String value = line.substring(prefix.length()).trim();
        return value.isEmpty() ? null : value;
    }
}
