package pl.marcinmilkowski.ngram_bayes.tokenize;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Language-agnostic tokenizer producing overlapping character n-grams.
 *
 * Every window of {@code n} chars starting at offsets 0 .. length - n is one
 * token (stride 1). Documents shorter than {@code n} yield no tokens.
 * No word boundary detection is needed, so the same tokenizer serves
 * languages written without spaces.
 */
public class NGramTokenizer implements DocumentTokenizer {

    public static final int DEFAULT_GRAM_SIZE = 2;

    private final int gramSize;

    public NGramTokenizer(int gramSize) {
        if (gramSize <= 0) {
            throw new IllegalArgumentException("n-gram size must be positive, got: " + gramSize);
        }
        this.gramSize = gramSize;
    }

    public NGramTokenizer() {
        this(DEFAULT_GRAM_SIZE);
    }

    @Override
    public Map<String, Integer> tokenize(String document) {
        Objects.requireNonNull(document, "document");
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i + gramSize <= document.length(); i++) {
            counts.merge(document.substring(i, i + gramSize), 1, Integer::sum);
        }
        return counts;
    }

    public int getGramSize() {
        return gramSize;
    }

    @Override
    public String getName() {
        return gramSize + "-gram";
    }
}
