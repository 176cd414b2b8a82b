package com.gsdorchestrator.intent;

import com.gsdorchestrator.extension.DetectionMethod;
import com.gsdorchestrator.extension.ExtensionCapabilities;
import com.gsdorchestrator.lifecycle.LifecycleStage;
import com.gsdorchestrator.models.CommandSpec;
import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.InstallLocation;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.PlanInfo;
import com.gsdorchestrator.models.ProjectState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private static CommandSpec command(String verb, String description, String objective) {
        return new CommandSpec("gsd:" + verb, description, null, List.of(), null, objective, verb + ".md");
    }

    private static DiscoveryResult discovery() {
        List<CommandSpec> commands = List.of(
            command("plan-phase", "Create detailed execution plan for a phase",
                "Create a detailed, executable plan for the specified phase"),
            command("execute-phase", "Execute all plans in a phase",
                "Run all plans in the phase with wave-based parallelization"),
            command("progress", "Show current project progress", "Check project progress and route to next action"),
            command("new-project", "Initialize a new project", "Set up a new project with deep context gathering"),
            command("debug", "Systematic debugging with persistent state", "Debug an issue systematically")
        );
        return new DiscoveryResult(commands, List.of(), List.of(), "/tmp/gsd", InstallLocation.GLOBAL, "1.12.1", 0L);
    }

    private static ProjectState executingState() {
        ProjectState state = new ProjectState();
        state.setInitialized(true);
        state.setHasRoadmap(true);
        List<PhaseInfo> phases = new ArrayList<>();
        phases.add(new PhaseInfo("37", "Discovery", true));
        phases.add(new PhaseInfo("38", "Routing", false));
        state.setPhases(phases);
        Map<String, List<PlanInfo>> plans = new LinkedHashMap<>();
        plans.put("38", List.of(new PlanInfo("38-01", false, "Classifier")));
        state.setPlansByPhase(plans);
        return state;
    }

    private static IntentClassifier trained() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery());
        return classifier;
    }

    @Test
    void uninitializedClassifierReturnsError() {
        ClassificationResult result = new IntentClassifier().classify("plan phase 3", executingState());
        assertEquals(ClassificationType.ERROR, result.getType());
        assertTrue(result.getMessage().contains("not initialized"));
    }

    @Test
    void initializeRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> new IntentClassifier().initialize(null));
    }

    @Test
    void explicitCommandIsAnExactMatch() {
        ClassificationResult result = trained().classify("/gsd:plan-phase 3 --research", executingState());
        assertEquals(ClassificationType.EXACT_MATCH, result.getType());
        assertEquals("gsd:plan-phase", result.commandName());
        assertEquals(1.0, result.getConfidence());
        assertEquals(ClassificationMethod.EXACT, result.getMethod());
        assertEquals("3", result.getArguments().getPhaseNumber());
        assertTrue(result.getArguments().hasFlag("research"));
        assertNull(result.getLifecycleStage());
    }

    @Test
    void exactMatchIgnoresLifecycleAndCase() {
        ProjectState uninitialized = ProjectState.uninitialized();
        ClassificationResult result = trained().classify("GSD:Execute-Phase", uninitialized);
        assertEquals(ClassificationType.EXACT_MATCH, result.getType());
        assertEquals("gsd:execute-phase", result.commandName());
        assertEquals("", result.getArguments().getRaw());
    }

    @Test
    void unknownExplicitCommandFallsThrough() {
        ClassificationResult result = trained().classify("/gsd:teleport now", executingState());
        assertNotEquals(ClassificationType.EXACT_MATCH, result.getType());
        assertEquals(ClassificationMethod.BAYES, result.getMethod());
    }

    @Test
    void naturalLanguageIsClassified() {
        ClassificationResult result = trained().classify("plan the next phase", executingState());
        assertEquals(ClassificationType.CLASSIFIED, result.getType());
        assertEquals("gsd:plan-phase", result.commandName());
        assertEquals(ClassificationMethod.BAYES, result.getMethod());
        assertEquals(LifecycleStage.EXECUTING, result.getLifecycleStage());
        assertEquals(0.62, result.getConfidence(), 0.02);
    }

    @Test
    void phaseNumberIsExtractedFromNaturalLanguage() {
        ClassificationResult result = trained().classify("plan phase 3", executingState());
        assertEquals(ClassificationType.CLASSIFIED, result.getType());
        assertEquals("3", result.getArguments().getPhaseNumber());
    }

    @Test
    void lifecycleDecidesWhichCommandsAreScored() {
        ClassificationResult result = trained().classify("initialize a new project", ProjectState.uninitialized());
        assertEquals(ClassificationType.CLASSIFIED, result.getType());
        assertEquals("gsd:new-project", result.commandName());
        assertEquals(LifecycleStage.UNINITIALIZED, result.getLifecycleStage());
        assertTrue(result.getConfidence() > 0.9);

        ClassificationResult executing = trained().classify("create a new project", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, executing.getType());
        assertTrue(executing.getAlternatives().stream()
            .noneMatch(score -> score.getCommand().getName().equals("gsd:new-project")));
    }

    @Test
    void closeScoresAreAmbiguous() {
        ClassificationResult result = trained().classify("phase", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, result.getType());
        assertNull(result.getCommand());
        assertEquals(3, result.getAlternatives().size());
        List<String> topTwo = result.getAlternatives().subList(0, 2).stream()
            .map(score -> score.getCommand().getName())
            .sorted()
            .collect(Collectors.toList());
        assertEquals(List.of("gsd:execute-phase", "gsd:plan-phase"), topTwo);
    }

    @Test
    void maxAlternativesIsConfigurable() {
        IntentClassifier classifier = new IntentClassifier(new IntentClassifier.Config().maxAlternatives(2));
        classifier.initialize(discovery());
        assertEquals(2, classifier.classify("phase", executingState()).getAlternatives().size());
    }

    @Test
    void unrelatedQueryIsAmbiguousWithoutAlternatives() {
        ClassificationResult result = trained().classify("what is the weather today in paris", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, result.getType());
        assertEquals(0.0, result.getConfidence());
        assertTrue(result.getAlternatives().isEmpty());
    }

    @Test
    void blankQueryIsAmbiguous() {
        ClassificationResult result = trained().classify("   ", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, result.getType());
        assertNull(result.getMethod());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void configRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new IntentClassifier.Config().confidenceThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> new IntentClassifier.Config().ambiguityGap(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new IntentClassifier.Config().maxAlternatives(0));
    }

    @Test
    void semanticMatchWinsWhenStatisticsAreWeak() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery(), true, ExtensionCapabilities.detected(DetectionMethod.CLI_BINARY, "1.0.0"));
        classifier.setSemanticMatcher(new FixedMatcher("gsd:debug", 0.9));
        assertTrue(classifier.isSemanticActive());

        ClassificationResult result = classifier.classify("phase", executingState());
        assertEquals(ClassificationType.CLASSIFIED, result.getType());
        assertEquals(ClassificationMethod.SEMANTIC, result.getMethod());
        assertEquals("gsd:debug", result.commandName());
        assertEquals(0.9, result.getConfidence());
    }

    @Test
    void weakSemanticMatchIsIgnored() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery(), true, ExtensionCapabilities.detected(DetectionMethod.CLI_BINARY, "1.0.0"));
        classifier.setSemanticMatcher(new FixedMatcher("gsd:debug", 0.5));

        ClassificationResult result = classifier.classify("phase", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, result.getType());
        assertEquals(ClassificationMethod.BAYES, result.getMethod());
    }

    @Test
    void strongStatisticsSkipTheSemanticLayer() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery(), true, ExtensionCapabilities.detected(DetectionMethod.CLI_BINARY, "1.0.0"));
        classifier.setSemanticMatcher(new FixedMatcher("gsd:debug", 0.99));

        ClassificationResult result = classifier.classify("show progress", executingState());
        assertEquals(ClassificationMethod.BAYES, result.getMethod());
        assertEquals("gsd:progress", result.commandName());
    }

    @Test
    void semanticLayerNeedsTheExtension() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery(), true, ExtensionCapabilities.none());
        classifier.setSemanticMatcher(new FixedMatcher("gsd:debug", 0.9));
        assertFalse(classifier.isSemanticActive());
        assertEquals(ClassificationMethod.BAYES, classifier.classify("phase", executingState()).getMethod());
    }

    @Test
    void failingMatcherFallsBackToStatistics() {
        IntentClassifier classifier = new IntentClassifier();
        classifier.initialize(discovery(), true, ExtensionCapabilities.detected(DetectionMethod.DIST_DIRECTORY, "1.0.0"));
        classifier.setSemanticMatcher(new SemanticMatcher() {
            @Override
            public boolean isReady() {
                return true;
            }

            @Override
            public List<SemanticMatch> match(String query, List<CommandSpec> candidates) {
                throw new IllegalStateException("embedding service down");
            }
        });

        ClassificationResult result = classifier.classify("phase", executingState());
        assertEquals(ClassificationType.AMBIGUOUS, result.getType());
        assertEquals(ClassificationMethod.BAYES, result.getMethod());
    }

    @Test
    void embeddingTextJoinsDescriptionAndObjective() {
        CommandSpec withObjective = command("debug", "Debug things", "Find the cause");
        CommandSpec withoutObjective = command("help", "Show help", null);
        assertEquals("Debug things. Find the cause", SemanticMatcher.embeddingText(withObjective));
        assertEquals("Show help", SemanticMatcher.embeddingText(withoutObjective));
    }

    private static final class FixedMatcher implements SemanticMatcher {
        private final String name;
        private final double similarity;

        FixedMatcher(String name, double similarity) {
            this.name = name;
            this.similarity = similarity;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public List<SemanticMatch> match(String query, List<CommandSpec> candidates) {
            List<SemanticMatch> matches = new ArrayList<>();
            for (CommandSpec candidate : candidates) {
                if (candidate.getName().equals(name)) {
                    matches.add(new SemanticMatch(candidate, similarity));
                }
            }
            return matches;
        }
    }
}
