package com.gsdorchestrator.intent;

import com.gsdorchestrator.AppLogger;
import com.gsdorchestrator.extension.ExtensionCapabilities;
import com.gsdorchestrator.lifecycle.LifecycleStage;
import com.gsdorchestrator.lifecycle.StageResolver;
import com.gsdorchestrator.models.CommandSpec;
import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.ProjectState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a user query to a discovered command.
 *
 * <ol>
 *   <li>Exact match: {@code /gsd:verb args} naming a discovered command, confidence 1.0.</li>
 *   <li>Lifecycle filter: only commands that fit the project's current stage are scored.</li>
 *   <li>Semantic fallback: when enabled and the statistical top score is weak, a confident
 *       {@link SemanticMatcher} result wins.</li>
 *   <li>Naive Bayes: {@code classified} when the top score clears the threshold and leads the runner-up
 *       by the ambiguity gap, otherwise {@code ambiguous} with the top candidates.</li>
 * </ol>
 *
 * {@link #initialize} builds an immutable model; {@link #classify} only reads it and is safe to call
 * concurrently. Re-initializing swaps the whole model at once.
 */
public class IntentClassifier {

    private final Config config;
    private final AppLogger logger;
    private volatile Trained trained;
    private volatile SemanticMatcher semanticMatcher;

    public IntentClassifier() {
        this(new Config());
    }

    public IntentClassifier(Config config) {
        this.config = config != null ? config : new Config();
        this.logger = AppLogger.get();
    }

    public Config getConfig() {
        return config;
    }

    public void initialize(DiscoveryResult discovery) {
        initialize(discovery, config.isEnableSemantic(), ExtensionCapabilities.none());
    }

    /**
     * @param enableSemantic request the semantic layer; it is only used when {@code capabilities} also
     *                       reports semantic classification and a matcher has been supplied
     */
    public void initialize(DiscoveryResult discovery, boolean enableSemantic, ExtensionCapabilities capabilities) {
        if (discovery == null) {
            throw new IllegalArgumentException("Discovery result is required");
        }
        Map<String, CommandSpec> byName = new LinkedHashMap<>();
        for (CommandSpec command : discovery.getCommands()) {
            byName.putIfAbsent(command.getName(), command);
        }
        boolean semanticAvailable = capabilities != null && capabilities.getFeatures().isSemanticClassification();
        this.trained = new Trained(byName, NaiveBayesModel.train(byName.values()), enableSemantic && semanticAvailable);

        logger.info("Intent classifier trained on " + byName.size() + " commands"
            + (enableSemantic && !semanticAvailable ? " (semantic requested but extension not available)" : ""));
    }

    public void setSemanticMatcher(SemanticMatcher semanticMatcher) {
        this.semanticMatcher = semanticMatcher;
    }

    public boolean isInitialized() {
        return trained != null;
    }

    /**
     * True when the semantic layer would be consulted for weak statistical results.
     */
    public boolean isSemanticActive() {
        Trained model = trained;
        SemanticMatcher matcher = semanticMatcher;
        return model != null && model.semanticEnabled && matcher != null && matcher.isReady();
    }

    public ClassificationResult classify(String query, ProjectState state) {
        Trained model = trained;
        if (model == null) {
            return ClassificationResult.error(query, "Classifier not initialized: call initialize() first");
        }
        if (query == null || query.isBlank()) {
            return new ClassificationResult(ClassificationType.AMBIGUOUS, null, 0.0, ExtractedArguments.empty(query),
                null, null, null, null);
        }
        String trimmed = query.trim();

        ExactMatcher.Match exact = ExactMatcher.match(trimmed, model.commandsByName);
        if (exact != null) {
            return new ClassificationResult(ClassificationType.EXACT_MATCH, exact.getCommand(), 1.0,
                ArgumentExtractor.extract(exact.getRawArgs(), true), ClassificationMethod.EXACT, null, null, null);
        }

        LifecycleStage stage = StageResolver.deriveLifecycleStage(state);
        List<CommandSpec> candidates = LifecycleFilter.filterByLifecycle(model.commands(), stage);
        if (candidates.isEmpty()) {
            candidates = model.commands();
        }
        Set<String> candidateNames = new LinkedHashSet<>();
        for (CommandSpec command : candidates) {
            candidateNames.add(command.getName());
        }

        ExtractedArguments arguments = ArgumentExtractor.extract(trimmed);
        List<NaiveBayesModel.Prediction> predictions = model.bayes.predict(trimmed, candidateNames);
        double topConfidence = predictions.isEmpty() ? 0.0 : predictions.get(0).getProbability();

        if (topConfidence < config.getConfidenceThreshold() && isSemanticActive()) {
            SemanticMatch semantic = semanticMatch(trimmed, candidates);
            if (semantic != null) {
                return new ClassificationResult(ClassificationType.CLASSIFIED, semantic.getCommand(),
                    semantic.getSimilarity(), arguments, ClassificationMethod.SEMANTIC, null, stage, null);
            }
        }

        if (predictions.isEmpty()) {
            return new ClassificationResult(ClassificationType.AMBIGUOUS, null, 0.0, arguments,
                ClassificationMethod.BAYES, null, stage, null);
        }

        double secondConfidence = predictions.size() > 1 ? predictions.get(1).getProbability() : 0.0;
        boolean meetsThreshold = topConfidence >= config.getConfidenceThreshold();
        boolean meetsGap = topConfidence - secondConfidence >= config.getAmbiguityGap();
        if (meetsThreshold && meetsGap) {
            CommandSpec command = model.commandsByName.get(predictions.get(0).getLabel());
            return new ClassificationResult(ClassificationType.CLASSIFIED, command, topConfidence, arguments,
                ClassificationMethod.BAYES, null, stage, null);
        }

        List<CommandScore> alternatives = new ArrayList<>();
        for (NaiveBayesModel.Prediction prediction : predictions) {
            if (alternatives.size() >= config.getMaxAlternatives()) {
                break;
            }
            alternatives.add(new CommandScore(model.commandsByName.get(prediction.getLabel()), prediction.getProbability()));
        }
        return new ClassificationResult(ClassificationType.AMBIGUOUS, null, topConfidence, arguments,
            ClassificationMethod.BAYES, alternatives, stage, null);
    }

    private SemanticMatch semanticMatch(String query, List<CommandSpec> candidates) {
        List<SemanticMatch> matches;
        try {
            matches = semanticMatcher.match(query, candidates);
        } catch (RuntimeException e) {
            logger.warn("Semantic matcher failed, using statistical result: " + e.getMessage());
            return null;
        }
        if (matches == null || matches.isEmpty()) {
            return null;
        }
        SemanticMatch best = matches.get(0);
        return best.getSimilarity() >= config.getSemanticThreshold() ? best : null;
    }

    private static final class Trained {
        private final Map<String, CommandSpec> commandsByName;
        private final List<CommandSpec> commandList;
        private final NaiveBayesModel bayes;
        private final boolean semanticEnabled;

        Trained(Map<String, CommandSpec> commandsByName, NaiveBayesModel bayes, boolean semanticEnabled) {
            this.commandsByName = Map.copyOf(commandsByName);
            this.commandList = List.copyOf(commandsByName.values());
            this.bayes = bayes;
            this.semanticEnabled = semanticEnabled;
        }

        List<CommandSpec> commands() {
            return commandList;
        }
    }

    /**
     * Classifier thresholds.
     */
    public static class Config {
        public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
        public static final double DEFAULT_AMBIGUITY_GAP = 0.15;
        public static final int DEFAULT_MAX_ALTERNATIVES = 3;
        public static final double DEFAULT_SEMANTIC_THRESHOLD = 0.7;

        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private double ambiguityGap = DEFAULT_AMBIGUITY_GAP;
        private int maxAlternatives = DEFAULT_MAX_ALTERNATIVES;
        private double semanticThreshold = DEFAULT_SEMANTIC_THRESHOLD;
        private boolean enableSemantic = false;

        public Config confidenceThreshold(double value) {
            this.confidenceThreshold = requireUnit("confidenceThreshold", value);
            return this;
        }

        public Config ambiguityGap(double value) {
            this.ambiguityGap = requireUnit("ambiguityGap", value);
            return this;
        }

        public Config maxAlternatives(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("maxAlternatives must be at least 1");
            }
            this.maxAlternatives = value;
            return this;
        }

        public Config semanticThreshold(double value) {
            this.semanticThreshold = requireUnit("semanticThreshold", value);
            return this;
        }

        public Config enableSemantic(boolean value) {
            this.enableSemantic = value;
            return this;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public double getAmbiguityGap() {
            return ambiguityGap;
        }

        public int getMaxAlternatives() {
            return maxAlternatives;
        }

        public double getSemanticThreshold() {
            return semanticThreshold;
        }

        public boolean isEnableSemantic() {
            return enableSemantic;
        }

        private static double requireUnit(String name, double value) {
            if (!(value >= 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException(name + " must be between 0 and 1, got " + value);
            }
            return value;
        }
    }
}
