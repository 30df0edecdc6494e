package pl.marcinmilkowski.ngram_bayes.tokenize;

import java.util.Map;

/**
 * Interface for tokenizers that split a raw document into countable tokens.
 *
 * Implementations must be deterministic: the same document always yields the
 * same token counts.
 */
public interface DocumentTokenizer {

    /**
     * Split a document into tokens and count their occurrences.
     *
     * @param document The input document (never null)
     * @return Token to occurrence count; empty when the document yields no tokens
     */
    Map<String, Integer> tokenize(String document);

    /**
     * Get the name of this tokenizer.
     */
    String getName();
}
