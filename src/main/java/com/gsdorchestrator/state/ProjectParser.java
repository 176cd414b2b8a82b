package com.gsdorchestrator.state;

import com.gsdorchestrator.models.ParsedProject;

import java.util.List;

/**
 * Parses PROJECT.md. Sections that are missing leave their field null.
 */
public class ProjectParser {

    public ParsedProject parse(String content) {
        if (MarkdownSections.isBlank(content)) {
            return null;
        }
        List<String> lines = MarkdownSections.lines(content);
        ParsedProject project = new ParsedProject();

        for (String raw : lines) {
            String line = raw.trim();
            if (project.getName() == null && line.startsWith("# ")) {
                project.setName(line.substring(2).trim());
            }
            if (project.getCurrentMilestone() == null && line.matches("^##\\s+Current Milestone:.*")) {
                String milestone = line.substring(line.indexOf(':') + 1).trim();
                project.setCurrentMilestone(milestone.isEmpty() ? null : milestone);
            }
        }

        project.setCoreValue(MarkdownSections.firstParagraph(MarkdownSections.level2Section(lines, "Core Value")));
        project.setDescription(MarkdownSections.firstParagraph(MarkdownSections.level2Section(lines, "What This Is")));
        return project;
    }
}
