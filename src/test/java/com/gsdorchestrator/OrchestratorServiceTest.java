package com.gsdorchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.discovery.DiscoveryCache;
import com.gsdorchestrator.discovery.GsdDiscoveryService;
import com.gsdorchestrator.extension.ExtensionCapabilities;
import com.gsdorchestrator.gates.GateAction;
import com.gsdorchestrator.gates.GateType;
import com.gsdorchestrator.gates.OperatingMode;
import com.gsdorchestrator.intent.ClassificationMethod;
import com.gsdorchestrator.intent.ClassificationResult;
import com.gsdorchestrator.intent.ClassificationType;
import com.gsdorchestrator.intent.IntentClassifier;
import com.gsdorchestrator.lifecycle.LifecycleStage;
import com.gsdorchestrator.lifecycle.LifecycleSuggestion;
import com.gsdorchestrator.models.AgentSpec;
import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.InstallLocation;
import com.gsdorchestrator.models.TeamSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorServiceTest {

    @TempDir
    Path tempDir;

    private Path fixture;
    private OrchestratorService service;

    @BeforeEach
    void setUp() throws URISyntaxException {
        fixture = Paths.get(getClass().getResource("/fixtures/gsd-v1.15").toURI());
        service = service(fixture.resolve("planning"), OperatingMode.YOLO);
    }

    private OrchestratorService service(Path planning, OperatingMode mode) {
        ObjectMapper mapper = new ObjectMapper();
        GsdDiscoveryService discovery = new GsdDiscoveryService(fixture, InstallLocation.LOCAL, new DiscoveryCache(), mapper);
        return new OrchestratorService(discovery, planning, ExtensionCapabilities.none(), new IntentClassifier(),
            mode, false, mapper);
    }

    @Test
    void discoversTheFixtureInstallation() {
        DiscoveryResult result = service.discover();
        assertEquals(27, result.getCommands().size());
        assertEquals("1.12.1", result.getVersion());
        assertEquals(InstallLocation.LOCAL, result.getLocation());
        assertTrue(service.getWarnings().isEmpty());

        List<String> agents = result.getAgents().stream().map(AgentSpec::getName).collect(Collectors.toList());
        assertEquals(5, agents.size());
        assertFalse(agents.contains("code-reviewer"));

        List<TeamSpec> teams = result.getTeams();
        assertEquals(2, teams.size());
        assertEquals(List.of(4, 3), teams.stream().map(TeamSpec::getMemberCount).collect(Collectors.toList()));
        assertEquals("gsd-planner", teams.get(0).getLeadAgentId());
        assertEquals("gsd-research-synthesizer", teams.get(1).getLeadAgentId());

        assertEquals("Debug an issue systematically using the scientific method.",
            result.findCommand("gsd:debug").getObjective());
        assertEquals("[phase] [--research]", result.findCommand("gsd:plan-phase").getArgumentHint());
    }

    @Test
    void classifiesAgainstTheCurrentStage() {
        ClassificationResult exact = service.classify("/gsd:plan-phase 3");
        assertEquals(ClassificationType.EXACT_MATCH, exact.getType());
        assertEquals("3", exact.getArguments().getPhaseNumber());

        ClassificationResult natural = service.classify("plan the next phase");
        assertEquals(ClassificationType.CLASSIFIED, natural.getType());
        assertEquals("gsd:plan-phase", natural.commandName());
        assertEquals(ClassificationMethod.BAYES, natural.getMethod());
        assertEquals(LifecycleStage.EXECUTING, natural.getLifecycleStage());

        ClassificationResult verify = service.classify("verify the work");
        assertEquals("gsd:verify-work", verify.commandName());
    }

    @Test
    void classifierIsTrainedOncePerDiscoveryResult() {
        service.classify("plan the next phase");
        assertTrue(service.getClassifier().isInitialized());
        DiscoveryResult first = service.discover();
        service.classify("verify the work");
        assertSame(first, service.discover());
    }

    @Test
    void suggestsContinuingExecution() {
        LifecycleSuggestion suggestion = service.suggestNextStep(null);
        assertEquals(LifecycleStage.EXECUTING, suggestion.getStage());
        assertEquals("gsd:execute-phase", suggestion.getPrimary().getCommand());
        assertEquals("3", suggestion.getPrimary().getArgs());
        assertEquals("Phase 3: 1/3 plans executed, 2 remaining.", suggestion.getContext());
    }

    @Test
    void projectConfigModeWinsOverDefault() {
        // the fixture's config.json says interactive, the service default is yolo
        assertEquals(OperatingMode.INTERACTIVE, service.effectiveMode());
        assertEquals(GateAction.CONFIRM, service.evaluateGate("gsd:remove-phase", null, 0.95).getAction());
        assertEquals(GateAction.PROCEED, service.evaluateGate("gsd:remove-phase", OperatingMode.YOLO, 0.95).getAction());
    }

    @Test
    void defaultModeAppliesWithoutProjectConfig() throws IOException {
        Path planning = Files.createDirectories(tempDir.resolve(".planning"));
        OrchestratorService bare = service(planning, OperatingMode.YOLO);
        assertEquals(OperatingMode.YOLO, bare.effectiveMode());
        assertEquals(GateType.DESTRUCTIVE, bare.evaluateGate("gsd:remove-phase", null, 1.0).getGateType());
        assertTrue(bare.evaluateGate("gsd:remove-phase", null, 1.0).isSkippedByYolo());
        assertEquals(LifecycleStage.INITIALIZED, bare.suggestNextStep(null).getStage());
    }

    @Test
    void validatesRawConfig() {
        assertTrue(service.validateConfig("{\"mode\":\"interactive\"}").isValid());
        assertFalse(service.validateConfig("{\"verbosity\":9}").isValid());
    }

    @Test
    void withoutInstallationClassificationIsAnError() {
        OrchestratorService none = new OrchestratorService(null, tempDir, null, null, null, false, new ObjectMapper());
        assertFalse(none.hasInstallation());
        assertTrue(none.getWarnings().isEmpty());
        assertEquals(ClassificationType.ERROR, none.classify("plan phase 3").getType());
        assertThrows(IllegalStateException.class, none::discover);
        assertFalse(none.getExtension().isDetected());
    }
}
