package pl.marcinmilkowski.ngram_bayes.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sparse frequency tables backing a Naive Bayes model.
 *
 * Holds three structures:
 * - documents per category (one per training call)
 * - token occurrences per category
 * - the vocabulary, every token seen in any category
 *
 * Counts only grow. Categories keep their first-training order, which
 * is the order the classifier visits them in. Not thread-safe.
 */
public class FrequencyStore {

    private final Map<String, Long> documentCounts = new LinkedHashMap<>();
    private final Map<String, Map<String, Long>> tokenCounts = new HashMap<>();
    private final Set<String> vocabulary = new HashSet<>();

    /**
     * Fold one tokenized document into the tables.
     *
     * @param category Category the document belongs to
     * @param documentTokens Token counts of the document, may be empty
     */
    public void addDocument(String category, Map<String, Integer> documentTokens) {
        Map<String, Long> table = tokenCounts.computeIfAbsent(category, c -> new HashMap<>());
        for (Map.Entry<String, Integer> entry : documentTokens.entrySet()) {
            vocabulary.add(entry.getKey());
            table.merge(entry.getKey(), entry.getValue().longValue(), Long::sum);
        }
        documentCounts.merge(category, 1L, Long::sum);
    }

    /**
     * Categories in first-training order.
     */
    public Set<String> getCategories() {
        return Collections.unmodifiableSet(documentCounts.keySet());
    }

    public int getCategoryCount() {
        return documentCounts.size();
    }

    public long getDocumentCount(String category) {
        return documentCounts.getOrDefault(category, 0L);
    }

    public long getTokenCount(String category, String token) {
        Map<String, Long> table = tokenCounts.get(category);
        return table == null ? 0L : table.getOrDefault(token, 0L);
    }

    /**
     * Sum of all token occurrences recorded for a category.
     * Recomputed on every call.
     */
    public long getTokenTotal(String category) {
        Map<String, Long> table = tokenCounts.get(category);
        if (table == null) {
            return 0L;
        }
        long total = 0L;
        for (long count : table.values()) {
            total += count;
        }
        return total;
    }

    public int getVocabularySize() {
        return vocabulary.size();
    }

    public boolean isEmpty() {
        return documentCounts.isEmpty();
    }
}
