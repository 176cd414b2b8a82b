package com.gsdorchestrator.state;

import com.gsdorchestrator.models.CapabilityRef;
import com.gsdorchestrator.models.ParsedRoadmap;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.PlanInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoadmapParserTest {

    private static final String ROADMAP = String.join("\n",
        "# Roadmap",
        "",
        "## Phases",
        "",
        "- [x] **Phase 1: Foundation** (Complete 2026-01-10) - Skeleton",
        "- [ ] **Phase 2.1: Hotfix** - Urgent fix",
        "- [ ] **Phase 3: Routing**",
        "- not a phase line",
        "",
        "## Phase Details",
        "",
        "### Phase 1: Foundation",
        "**Capabilities**: use: skill/a, skill/b, create: agent/gsd-c",
        "Plans:",
        "- [x] 01-01-PLAN.md -- Skeleton",
        "- [X] 01-02: Logging",
        "",
        "### Phase 2.1: Hotfix",
        "- [ ] 02.1-01",
        "",
        "## Notes",
        "- [ ] 09-01-PLAN.md -- outside any phase section",
        "");

    private final RoadmapParser parser = new RoadmapParser();

    @Test
    void parsesPhaseChecklist() {
        ParsedRoadmap roadmap = parser.parse(ROADMAP);
        List<PhaseInfo> phases = roadmap.getPhases();
        assertEquals(3, phases.size());

        PhaseInfo first = phases.get(0);
        assertEquals("1", first.getNumber());
        assertEquals("Foundation", first.getName());
        assertTrue(first.isComplete());
        assertEquals("Complete 2026-01-10", first.getCompletedInfo());
        assertEquals("Skeleton", first.getDescription());

        PhaseInfo hotfix = phases.get(1);
        assertEquals("2.1", hotfix.getNumber());
        assertFalse(hotfix.isComplete());
        assertNull(hotfix.getCompletedInfo());
        assertEquals("Urgent fix", hotfix.getDescription());

        assertNull(phases.get(2).getDescription());
    }

    @Test
    void parsesPlansPerPhase() {
        ParsedRoadmap roadmap = parser.parse(ROADMAP);
        List<PlanInfo> plans = roadmap.getPlansByPhase().get("1");
        assertEquals(2, plans.size());
        assertEquals("01-01", plans.get(0).getId());
        assertEquals("Skeleton", plans.get(0).getDescription());
        assertTrue(plans.get(1).isComplete());
        assertEquals("Logging", plans.get(1).getDescription());

        List<PlanInfo> hotfixPlans = roadmap.getPlansByPhase().get("2.1");
        assertEquals(1, hotfixPlans.size());
        assertFalse(hotfixPlans.get(0).isComplete());
        assertNull(hotfixPlans.get(0).getDescription());

        assertFalse(roadmap.getPlansByPhase().containsKey("9"));
    }

    @Test
    void capabilitiesCarryTheLastVerb() {
        List<CapabilityRef> caps = parser.parse(ROADMAP).getCapabilitiesByPhase().get("1");
        assertEquals(List.of(
            new CapabilityRef("use", "skill", "a"),
            new CapabilityRef("use", "skill", "b"),
            new CapabilityRef("create", "agent", "gsd-c")), caps);
    }

    @Test
    void noCapabilitiesMeansNullMap() {
        ParsedRoadmap roadmap = parser.parse("## Phases\n- [ ] **Phase 1: Only**\n");
        assertNull(roadmap.getCapabilitiesByPhase());
        assertTrue(roadmap.getPlansByPhase().isEmpty());
    }

    @Test
    void missingPhasesSectionOrBlankInputIsNull() {
        assertNull(parser.parse("# Roadmap\n\nNothing planned yet.\n"));
        assertNull(parser.parse("   "));
        assertNull(parser.parse(null));
    }
}
