package com.gsdorchestrator.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lower-cases, splits on anything that is not a letter or digit, drops stop words and folds simple
 * plurals ({@code plans} to {@code plan}). Training text and queries go through the same steps.
 */
final class Tokenizer {

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "to", "for", "of", "and", "or", "in", "on", "at", "with", "by", "from",
        "my", "me", "i", "is", "it", "its", "this", "that", "be", "are", "was", "please", "can",
        "you", "we", "our", "do", "what", "how", "some", "any", "into"
    );

    private Tokenizer() {
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (word.isEmpty() || STOP_WORDS.contains(word)) {
                continue;
            }
            tokens.add(stem(word));
        }
        return tokens;
    }

    private static String stem(String word) {
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
