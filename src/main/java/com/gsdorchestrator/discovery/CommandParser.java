package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.CommandSpec;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CommandParser {

    // Non-greedy: later <objective> tags quoted inside instructions are not part of the first block.
    private static final Pattern OBJECTIVE = Pattern.compile("<objective>(.*?)</objective>", Pattern.DOTALL);

    private final FrontmatterParser frontmatterParser;

    public CommandParser(FrontmatterParser frontmatterParser) {
        this.frontmatterParser = frontmatterParser;
    }

    public CommandSpec parse(String content, String path) {
        FrontmatterParser.Document doc = frontmatterParser.parse(content, path);
        if (doc.isEmpty()) {
            throw new ArtifactParseException(path, "Empty frontmatter");
        }
        String name = doc.string("name");
        if (name == null) {
            throw new ArtifactParseException(path, "Command is missing required field 'name'");
        }
        String description = doc.string("description");
        if (description == null) {
            throw new ArtifactParseException(path, "Command is missing required field 'description'");
        }
        return new CommandSpec(
            name,
            description,
            doc.string("argument-hint"),
            doc.stringList("allowed-tools"),
            doc.string("agent"),
            extractObjective(doc.getBody()),
            path
        );
    }

    static String extractObjective(String body) {
        if (body == null) {
            return null;
        }
        Matcher matcher = OBJECTIVE.matcher(body);
        if (!matcher.find()) {
            return null;
        }
        String objective = matcher.group(1).trim();
        return objective.isEmpty() ? null : objective;
    }
}
