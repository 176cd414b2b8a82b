package com.gsdorchestrator.verbosity;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class VerbosityControllerTest {

    private static List<OutputSection> sections() {
        List<OutputSection> sections = new ArrayList<>();
        sections.add(new OutputSection("result", "Routed to gsd:plan-phase", 1));
        sections.add(new OutputSection("summary", "Phase 3, executing", 2));
        sections.add(new OutputSection("classification", "confidence 0.62"));
        sections.add(new OutputSection("alternatives", "gsd:execute-phase 0.31", 4));
        sections.add(new OutputSection("trace", "tokens: plan, next, phase", 5));
        return sections;
    }

    private static List<String> tags(List<OutputSection> sections) {
        return sections.stream().map(OutputSection::getTag).collect(Collectors.toList());
    }

    @Test
    void levelsAreCumulative() {
        assertEquals(List.of("result"), tags(VerbosityController.filterByVerbosity(sections(), VerbosityLevel.SILENT)));
        assertEquals(List.of("result", "summary", "classification"),
            tags(VerbosityController.filterByVerbosity(sections(), VerbosityLevel.STANDARD)));
        assertEquals(5, VerbosityController.filterByVerbosity(sections(), VerbosityLevel.TRANSPARENT).size());
    }

    @Test
    void inputIsNotModified() {
        List<OutputSection> input = sections();
        VerbosityController.filterByVerbosity(input, 1);
        assertEquals(5, input.size());
    }

    @Test
    void emptyOrNullInputYieldsEmptyList() {
        assertTrue(VerbosityController.filterByVerbosity(null, 3).isEmpty());
        assertTrue(VerbosityController.filterByVerbosity(List.of(), 3).isEmpty());
    }

    @Test
    void sectionDefaultsToStandard() {
        assertEquals(3, new OutputSection("x", "y").getMinLevel());
    }

    @Test
    void invalidLevelsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OutputSection("x", "y", 0));
        assertThrows(IllegalArgumentException.class, () -> VerbosityLevel.fromValue(6));
        assertThrows(IllegalArgumentException.class, () -> VerbosityLevel.parse("3"));
        assertThrows(IllegalArgumentException.class, () -> VerbosityLevel.parse(2.5));
    }

    @Test
    void parseAcceptsWholeNumbers() {
        assertEquals(VerbosityLevel.STANDARD, VerbosityLevel.parse(null));
        assertEquals(VerbosityLevel.DETAILED, VerbosityLevel.parse(4));
        assertEquals(VerbosityLevel.MINIMAL, VerbosityLevel.parse(2.0));
    }
}
