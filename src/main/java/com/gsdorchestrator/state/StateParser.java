package com.gsdorchestrator.state;

import com.gsdorchestrator.models.CurrentPosition;
import com.gsdorchestrator.models.ParsedState;
import com.gsdorchestrator.models.SessionContinuity;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses STATE.md.
 *
 * <pre>
 * ## Current Position
 * Phase: 3 of 10 (Intent Classification) -- In progress
 * Plan: 2 of 4
 * Status: Executing plan 03-02
 * Last activity: 2026-01-12 - Completed 03-01-PLAN.md
 * Progress: [#####-----] 45%
 * </pre>
 */
public class StateParser {

    static final Pattern PHASE_LINE = Pattern.compile(
        "^Phase:\\s+(\\d+(?:\\.\\d+)?)\\s+of\\s+(\\d+)\\s*\\((.+?)\\)\\s*(?:--\\s*(.+))?$");
    static final Pattern PLAN_LINE = Pattern.compile("^Plan:\\s+(\\d+)\\s+of\\s+(\\d+)");
    private static final Pattern PERCENT = Pattern.compile("(\\d+)%");

    /**
     * @return the parsed state, or null for blank input or when no position field is present
     */
    public ParsedState parse(String content) {
        if (MarkdownSections.isBlank(content)) {
            return null;
        }
        List<String> lines = MarkdownSections.lines(content);

        CurrentPosition position = parsePosition(MarkdownSections.level2Section(lines, "Current Position"));
        if (position == null) {
            return null;
        }

        ParsedState state = new ParsedState();
        state.setPosition(position);
        state.setDecisions(MarkdownSections.bullets(MarkdownSections.level3Section(lines, "Decisions")));
        state.setBlockers(MarkdownSections.bullets(MarkdownSections.level3Section(lines, "Blockers/Concerns")));
        state.setPendingTodos(MarkdownSections.bullets(MarkdownSections.level3Section(lines, "Pending Todos")));
        state.setSessionContinuity(parseContinuity(MarkdownSections.level2Section(lines, "Session Continuity")));
        return state;
    }

    private CurrentPosition parsePosition(List<String> section) {
        if (section == null) {
            return null;
        }
        CurrentPosition position = new CurrentPosition();
        boolean found = false;

        for (String line : section) {
            Matcher phase = PHASE_LINE.matcher(line);
            if (phase.matches()) {
                position.setPhase(Double.parseDouble(phase.group(1)));
                position.setTotalPhases(toInt(phase.group(2)));
                position.setPhaseName(phase.group(3).trim());
                position.setPhaseStatus(phase.group(4) != null ? phase.group(4).trim() : null);
                found = true;
                continue;
            }
            Matcher plan = PLAN_LINE.matcher(line);
            if (plan.find()) {
                position.setPlan(toInt(plan.group(1)));
                position.setTotalPlans(toInt(plan.group(2)));
                found = true;
                continue;
            }
            String status = MarkdownSections.labelled(line, "Status");
            if (status != null) {
                position.setStatus(status);
                found = true;
                continue;
            }
            String lastActivity = MarkdownSections.labelled(line, "Last activity");
            if (lastActivity != null) {
                position.setLastActivity(lastActivity);
                found = true;
                continue;
            }
            String progress = MarkdownSections.labelled(line, "Progress");
            if (progress != null) {
                Matcher percent = PERCENT.matcher(progress);
                Integer value = percent.find() ? toInt(percent.group(1)) : null;
                if (value != null) {
                    position.setProgressPercent(value);
                    found = true;
                }
            }
        }
        return found ? position : null;
    }

    /**
     * Digits that overflow an int leave the field unset.
     */
    private static Integer toInt(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private SessionContinuity parseContinuity(List<String> section) {
        SessionContinuity continuity = new SessionContinuity();
        if (section == null) {
            return continuity;
        }
        for (String line : section) {
            String value;
            if ((value = MarkdownSections.labelled(line, "Last session")) != null) {
                continuity.setLastSession(value);
            } else if ((value = MarkdownSections.labelled(line, "Stopped at")) != null) {
                continuity.setStoppedAt(value);
            } else if ((value = MarkdownSections.labelled(line, "Resume file")) != null) {
                continuity.setResumeFile(value);
            }
        }
        return continuity;
    }
}
