package com.gsdorchestrator.state;

import com.gsdorchestrator.models.CapabilityRef;
import com.gsdorchestrator.models.ParsedRoadmap;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.PlanInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses ROADMAP.md: the {@code ## Phases} checklist plus the per-phase detail sections that list plans
 * and capabilities. Lines that do not match the expected shapes are ignored.
 */
public class RoadmapParser {

    static final Pattern PHASE_LINE = Pattern.compile(
        "^[-*]\\s+\\[([ xX])\\]\\s+\\*\\*Phase\\s+(\\d+(?:\\.\\d+)?):\\s*(.+?)\\*\\*"
            + "\\s*(?:\\(([^)]*)\\))?\\s*(?:[-–—]+\\s*(.*))?$");
    static final Pattern DETAIL_HEADING = Pattern.compile("^#{3,4}\\s+Phase\\s+(\\d+(?:\\.\\d+)?):.*$");
    static final Pattern PLAN_LINE = Pattern.compile(
        "^[-*]\\s+\\[([ xX])\\]\\s+(\\d+(?:\\.\\d+)?-\\d+)(?:-PLAN\\.md)?(?:\\s*(?:--|:|—)\\s*(.*))?$");
    private static final Pattern CAPABILITIES = Pattern.compile("^\\*\\*Capabilities\\*\\*:\\s*(.+)$");
    private static final Pattern CAPABILITY_ITEM = Pattern.compile("^(?:([A-Za-z][\\w-]*):\\s*)?([\\w-]+)/([\\w.@-]+)$");
    private static final Pattern ANY_HEADING = Pattern.compile("^#{1,4}\\s+.*$");

    public ParsedRoadmap parse(String content) {
        if (MarkdownSections.isBlank(content)) {
            return null;
        }
        List<String> lines = MarkdownSections.lines(content);
        List<String> checklist = MarkdownSections.level2Section(lines, "Phases");
        if (checklist == null) {
            return null;
        }

        ParsedRoadmap roadmap = new ParsedRoadmap();
        roadmap.setPhases(parsePhases(checklist));
        parseDetails(lines, roadmap);
        return roadmap;
    }

    private List<PhaseInfo> parsePhases(List<String> checklist) {
        List<PhaseInfo> phases = new ArrayList<>();
        for (String line : checklist) {
            Matcher m = PHASE_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            PhaseInfo phase = new PhaseInfo(m.group(2), m.group(3).trim(), !" ".equals(m.group(1)));
            phase.setCompletedInfo(blankToNull(m.group(4)));
            phase.setDescription(blankToNull(m.group(5)));
            phases.add(phase);
        }
        return phases;
    }

    private void parseDetails(List<String> lines, ParsedRoadmap roadmap) {
        Map<String, List<PlanInfo>> plansByPhase = new LinkedHashMap<>();
        Map<String, List<CapabilityRef>> capabilitiesByPhase = new LinkedHashMap<>();

        String currentPhase = null;
        for (String raw : lines) {
            String line = raw.trim();
            Matcher heading = DETAIL_HEADING.matcher(line);
            if (heading.matches()) {
                currentPhase = heading.group(1);
                plansByPhase.putIfAbsent(currentPhase, new ArrayList<>());
                continue;
            }
            if (ANY_HEADING.matcher(line).matches()) {
                currentPhase = null;
                continue;
            }
            if (currentPhase == null) {
                continue;
            }

            Matcher plan = PLAN_LINE.matcher(line);
            if (plan.matches()) {
                plansByPhase.get(currentPhase).add(
                    new PlanInfo(plan.group(2), !" ".equals(plan.group(1)), blankToNull(plan.group(3))));
                continue;
            }

            Matcher caps = CAPABILITIES.matcher(line);
            if (caps.matches()) {
                List<CapabilityRef> refs = parseCapabilities(caps.group(1));
                if (!refs.isEmpty()) {
                    capabilitiesByPhase.computeIfAbsent(currentPhase, k -> new ArrayList<>()).addAll(refs);
                }
            }
        }

        roadmap.setPlansByPhase(plansByPhase);
        roadmap.setCapabilitiesByPhase(capabilitiesByPhase.isEmpty() ? null : capabilitiesByPhase);
    }

    /**
     * {@code use: skill/a, skill/b, create: agent/c}: an item without a verb takes the previous verb.
     */
    static List<CapabilityRef> parseCapabilities(String text) {
        List<CapabilityRef> refs = new ArrayList<>();
        String verb = "use";
        for (String item : text.split(",")) {
            Matcher m = CAPABILITY_ITEM.matcher(item.trim());
            if (!m.matches()) {
                continue;
            }
            if (m.group(1) != null) {
                verb = m.group(1);
            }
            refs.add(new CapabilityRef(verb, m.group(2), m.group(3)));
        }
        return refs;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
