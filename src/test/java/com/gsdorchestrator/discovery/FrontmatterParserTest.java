package com.gsdorchestrator.discovery;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrontmatterParserTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    @Test
    void splitsHeaderAndBody() {
        String content = "---\nname: gsd:progress\ndescription: Show current project progress\n---\n\nBody text\n";
        FrontmatterParser.Document doc = parser.parse(content, "progress.md");
        assertEquals("gsd:progress", doc.string("name"));
        assertEquals("Show current project progress", doc.string("description"));
        assertEquals("\nBody text\n", doc.getBody());
    }

    @Test
    void emptyHeaderYieldsEmptyDocument() {
        FrontmatterParser.Document doc = parser.parse("---\n---\nbody", "empty.md");
        assertTrue(doc.isEmpty());
        assertEquals("body", doc.getBody());
    }

    @Test
    void missingHeaderIsRejected() {
        ArtifactParseException e = assertThrows(ArtifactParseException.class,
            () -> parser.parse("# Just markdown\n", "plain.md"));
        assertEquals("plain.md", e.getPath());
    }

    @Test
    void invalidYamlIsRejected() {
        assertThrows(ArtifactParseException.class,
            () -> parser.parse("---\nname: [unclosed\n---\n", "broken.md"));
    }

    @Test
    void scalarHeaderIsRejected() {
        assertThrows(ArtifactParseException.class,
            () -> parser.parse("---\njust a string\n---\n", "scalar.md"));
    }

    @Test
    void byteOrderMarkIsIgnored() {
        FrontmatterParser.Document doc = parser.parse("\uFEFF---\nname: gsd:help\n---\n", "help.md");
        assertEquals("gsd:help", doc.string("name"));
    }

    @Test
    void stringListAcceptsSequenceOrCommaString() {
        FrontmatterParser.Document doc = parser.parse(
            "---\nallowed-tools:\n  - Read\n  - Bash\ntools: Read, Write,  Grep\n---\n", "tools.md");
        assertEquals(List.of("Read", "Bash"), doc.stringList("allowed-tools"));
        assertEquals(List.of("Read", "Write", "Grep"), doc.stringList("tools"));
        assertTrue(doc.stringList("missing").isEmpty());
    }

    @Test
    void unquotedBracketHintIsRestored() {
        FrontmatterParser.Document doc = parser.parse("---\nargument-hint: [phase]\n---\n", "hint.md");
        assertEquals("[phase]", doc.string("argument-hint"));
    }
}
