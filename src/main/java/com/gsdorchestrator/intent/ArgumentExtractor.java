package com.gsdorchestrator.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls phase numbers, flags, versions, model profiles and descriptions out of free text or the
 * argument tail of an explicit command.
 *
 * <p>Quoted text, flags and version strings are removed before looking for a phase number, so
 * {@code v1.2} is never read as phase {@code 1.2}.
 */
public final class ArgumentExtractor {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"|'([^']*)'");
    private static final Pattern FLAG = Pattern.compile("(?<![\\w-])--([a-zA-Z][\\w-]*)");
    private static final Pattern VERSION = Pattern.compile("(?<![\\w.])[vV](\\d+(?:\\.\\d+)+)\\b");
    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])(\\d+(?:\\.\\d+)?)\\b");
    private static final Pattern PROFILE = Pattern.compile("\\b(quality|balanced|budget)\\b", Pattern.CASE_INSENSITIVE);

    private ArgumentExtractor() {
    }

    /**
     * Arguments of a natural-language query. Only quoted text counts as a description.
     */
    public static ExtractedArguments extract(String input) {
        return extract(input, false);
    }

    /**
     * @param remainderIsDescription when true (explicit command arguments), words left over after
     *                               extraction become the description
     */
    public static ExtractedArguments extract(String input, boolean remainderIsDescription) {
        if (input == null || input.isBlank()) {
            return ExtractedArguments.empty(input);
        }
        String work = input;

        String quoted = null;
        Matcher q = QUOTED.matcher(work);
        if (q.find()) {
            quoted = q.group(1) != null ? q.group(1) : q.group(2);
            work = q.replaceAll(" ");
        }

        List<String> flags = new ArrayList<>();
        Matcher f = FLAG.matcher(work);
        while (f.find()) {
            String flag = f.group(1).toLowerCase(Locale.ROOT);
            if (!flags.contains(flag)) {
                flags.add(flag);
            }
        }
        work = f.replaceAll(" ");

        String version = null;
        Matcher v = VERSION.matcher(work);
        if (v.find()) {
            version = "v" + v.group(1);
            work = v.replaceAll(" ");
        }

        String phaseNumber = null;
        Matcher n = NUMBER.matcher(work);
        if (n.find()) {
            phaseNumber = n.group(1);
            work = work.substring(0, n.start()) + " " + work.substring(n.end());
        }

        String profile = null;
        Matcher p = PROFILE.matcher(work);
        if (p.find()) {
            profile = p.group(1).toLowerCase(Locale.ROOT);
            work = p.replaceAll(" ");
        }

        String description = quoted;
        if (description == null && remainderIsDescription) {
            String rest = work.trim().replaceAll("\\s+", " ");
            description = rest.isEmpty() ? null : rest;
        }
        if (description != null && description.isBlank()) {
            description = null;
        }
        return new ExtractedArguments(phaseNumber, flags, description, version, profile, input);
    }
}
