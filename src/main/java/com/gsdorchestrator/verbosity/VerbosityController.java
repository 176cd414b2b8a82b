package com.gsdorchestrator.verbosity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class VerbosityController {

    private VerbosityController() {
    }

    /**
     * Sections visible at {@code level}, in input order. The input list is left untouched.
     */
    public static List<OutputSection> filterByVerbosity(List<OutputSection> sections, VerbosityLevel level) {
        return filterByVerbosity(sections, level.getValue());
    }

    public static List<OutputSection> filterByVerbosity(List<OutputSection> sections, int level) {
        if (sections == null || sections.isEmpty()) {
            return new ArrayList<>();
        }
        return sections.stream()
            .filter(section -> section != null && section.getMinLevel() <= level)
            .collect(Collectors.toList());
    }
}
