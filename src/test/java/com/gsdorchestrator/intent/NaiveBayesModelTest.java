package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NaiveBayesModelTest {

    private static CommandSpec command(String verb, String description, String objective) {
        return new CommandSpec("gsd:" + verb, description, null, List.of(), null, objective, verb + ".md");
    }

    private static final List<CommandSpec> COMMANDS = List.of(
        command("plan-phase", "Create detailed execution plan for a phase",
            "Create a detailed, executable plan for the specified phase"),
        command("execute-phase", "Execute all plans in a phase",
            "Run all plans in the phase with wave-based parallelization"),
        command("progress", "Show current project progress", "Check project progress and route to next action"),
        command("debug", "Systematic debugging with persistent state", "Debug an issue systematically")
    );

    @Test
    void verbWordsAreWeighted() {
        List<String> tokens = NaiveBayesModel.trainingTokens(COMMANDS.get(2));
        long progressCount = tokens.stream().filter("progress"::equals).count();
        assertEquals(2 + NaiveBayesModel.VERB_WEIGHT, progressCount);
        assertFalse(tokens.contains("and"));
    }

    @Test
    void tokenizerFoldsPluralsAndDropsStopWords() {
        assertEquals(List.of("run", "plan", "class", "gas"), Tokenizer.tokenize("Run the PLANS, class gas"));
    }

    @Test
    void probabilitiesSumToOneAndAreSorted() {
        NaiveBayesModel model = NaiveBayesModel.train(COMMANDS);
        List<NaiveBayesModel.Prediction> predictions = model.predict("execute phase 3", null);

        assertEquals(4, predictions.size());
        assertEquals("gsd:execute-phase", predictions.get(0).getLabel());
        assertEquals(0.779, predictions.get(0).getProbability(), 0.005);
        double sum = predictions.stream().mapToDouble(NaiveBayesModel.Prediction::getProbability).sum();
        assertEquals(1.0, sum, 1e-9);
        for (int i = 1; i < predictions.size(); i++) {
            assertTrue(predictions.get(i - 1).getProbability() >= predictions.get(i).getProbability());
        }
    }

    @Test
    void candidatesRestrictTheLabels() {
        NaiveBayesModel model = NaiveBayesModel.train(COMMANDS);
        List<NaiveBayesModel.Prediction> predictions =
            model.predict("show progress", Set.of("gsd:progress", "gsd:debug", "gsd:unknown"));
        assertEquals(2, predictions.size());
        assertEquals("gsd:progress", predictions.get(0).getLabel());
    }

    @Test
    void queryWithoutKnownWordsPredictsNothing() {
        NaiveBayesModel model = NaiveBayesModel.train(COMMANDS);
        assertTrue(model.predict("what is the weather today in paris", null).isEmpty());
        assertTrue(model.predict("", null).isEmpty());
    }

    @Test
    void duplicateNamesTrainOnce() {
        NaiveBayesModel model = NaiveBayesModel.train(List.of(COMMANDS.get(0), COMMANDS.get(0), COMMANDS.get(1)));
        assertEquals(List.of("gsd:plan-phase", "gsd:execute-phase"), model.getLabels());
        assertTrue(model.vocabularySize() > 0);
    }
}
