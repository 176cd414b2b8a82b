package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multinomial naive Bayes over command descriptions with additive (Laplace) smoothing.
 *
 * <p>Each command is one class trained on its description, its objective and the words of its verb
 * ({@code plan-phase} contributes {@code plan phase}, weighted {@value #VERB_WEIGHT} times). Every class
 * has exactly one training document, so priors are uniform and drop out. Query tokens outside the
 * vocabulary carry no evidence and are ignored.
 *
 * <p>Instances are immutable once {@link #train} returns and may be shared between threads.
 */
public final class NaiveBayesModel {

    public static final double ALPHA = 1.0;
    static final int VERB_WEIGHT = 3;

    private final List<String> labels;
    private final Map<String, Map<String, Integer>> tokenCounts;
    private final Map<String, Integer> totals;
    private final Set<String> vocabulary;

    private NaiveBayesModel(List<String> labels, Map<String, Map<String, Integer>> tokenCounts,
                            Map<String, Integer> totals, Set<String> vocabulary) {
        this.labels = Collections.unmodifiableList(labels);
        this.tokenCounts = Collections.unmodifiableMap(tokenCounts);
        this.totals = Collections.unmodifiableMap(totals);
        this.vocabulary = Collections.unmodifiableSet(vocabulary);
    }

    public static NaiveBayesModel train(Collection<CommandSpec> commands) {
        List<String> labels = new ArrayList<>();
        Map<String, Map<String, Integer>> counts = new HashMap<>();
        Map<String, Integer> totals = new HashMap<>();
        Set<String> vocabulary = new HashSet<>();

        for (CommandSpec command : commands) {
            String label = command.getName();
            if (counts.containsKey(label)) {
                continue;
            }
            List<String> tokens = trainingTokens(command);
            Map<String, Integer> perToken = new HashMap<>();
            for (String token : tokens) {
                perToken.merge(token, 1, Integer::sum);
            }
            labels.add(label);
            counts.put(label, Collections.unmodifiableMap(perToken));
            totals.put(label, tokens.size());
            vocabulary.addAll(perToken.keySet());
        }
        return new NaiveBayesModel(labels, counts, totals, vocabulary);
    }

    static List<String> trainingTokens(CommandSpec command) {
        List<String> tokens = new ArrayList<>(Tokenizer.tokenize(command.getDescription()));
        tokens.addAll(Tokenizer.tokenize(command.getObjective()));
        List<String> verbWords = Tokenizer.tokenize(command.verb());
        for (int i = 0; i < VERB_WEIGHT; i++) {
            tokens.addAll(verbWords);
        }
        return tokens;
    }

    public List<String> getLabels() {
        return labels;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    /**
     * Posterior probability of each candidate label, highest first. Candidates that the model was not
     * trained on are ignored. Returns an empty list when the query shares no token with the vocabulary.
     */
    public List<Prediction> predict(String query, Set<String> candidates) {
        List<String> tokens = new ArrayList<>();
        for (String token : Tokenizer.tokenize(query)) {
            if (vocabulary.contains(token)) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, Double> logLikelihoods = new LinkedHashMap<>();
        double max = Double.NEGATIVE_INFINITY;
        for (String label : labels) {
            if (candidates != null && !candidates.contains(label)) {
                continue;
            }
            Map<String, Integer> counts = tokenCounts.get(label);
            double denominator = totals.get(label) + ALPHA * vocabulary.size();
            double logLikelihood = 0.0;
            for (String token : tokens) {
                logLikelihood += Math.log((counts.getOrDefault(token, 0) + ALPHA) / denominator);
            }
            logLikelihoods.put(label, logLikelihood);
            max = Math.max(max, logLikelihood);
        }
        if (logLikelihoods.isEmpty()) {
            return Collections.emptyList();
        }

        // log-sum-exp keeps long queries from underflowing
        double sum = 0.0;
        for (double value : logLikelihoods.values()) {
            sum += Math.exp(value - max);
        }
        List<Prediction> predictions = new ArrayList<>();
        for (Map.Entry<String, Double> entry : logLikelihoods.entrySet()) {
            predictions.add(new Prediction(entry.getKey(), Math.exp(entry.getValue() - max) / sum));
        }
        predictions.sort((a, b) -> Double.compare(b.getProbability(), a.getProbability()));
        return predictions;
    }

    public static final class Prediction {
        private final String label;
        private final double probability;

        Prediction(String label, double probability) {
            this.label = label;
            this.probability = probability;
        }

        public String getLabel() {
            return label;
        }

        public double getProbability() {
            return probability;
        }
    }
}
