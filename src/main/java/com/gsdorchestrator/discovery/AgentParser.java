package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.AgentSpec;

public class AgentParser {

    private final FrontmatterParser frontmatterParser;

    public AgentParser(FrontmatterParser frontmatterParser) {
        this.frontmatterParser = frontmatterParser;
    }

    public AgentSpec parse(String content, String path) {
        FrontmatterParser.Document doc = frontmatterParser.parse(content, path);
        if (doc.isEmpty()) {
            throw new ArtifactParseException(path, "Empty frontmatter");
        }
        String name = doc.string("name");
        if (name == null) {
            throw new ArtifactParseException(path, "Agent is missing required field 'name'");
        }
        String description = doc.string("description");
        if (description == null) {
            throw new ArtifactParseException(path, "Agent is missing required field 'description'");
        }
        String tools = doc.stringList("tools").isEmpty() ? null : String.join(", ", doc.stringList("tools"));
        return new AgentSpec(name, description, tools, doc.string("model"), doc.string("color"), path);
    }
}
