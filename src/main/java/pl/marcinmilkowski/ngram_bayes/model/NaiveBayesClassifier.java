package pl.marcinmilkowski.ngram_bayes.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ngram_bayes.tokenize.DocumentTokenizer;
import pl.marcinmilkowski.ngram_bayes.tokenize.NGramTokenizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multinomial Naive Bayes text classifier.
 *
 * Documents are split by a {@link DocumentTokenizer} (character n-grams by
 * default). A category's score is its log-posterior up to a constant:
 *
 *   ln(docs(c) / |categories|)
 *     + sum over document tokens t: count(t) * ln((f(c, t) + 1) / (total(c) + |V|))
 *
 * Where:
 * - docs(c) = number of training calls for category c
 * - f(c, t) = occurrences of token t in training text of c
 * - total(c) = all token occurrences recorded for c
 * - |V| = vocabulary size across all categories
 *
 * Scores are summed in log space so long documents do not underflow.
 * Add-one smoothing keeps every likelihood ratio strictly positive.
 *
 * Instances are not thread-safe: {@link #train} must not run concurrently
 * with any other call on the same instance.
 */
public class NaiveBayesClassifier {

    private static final Logger logger = LoggerFactory.getLogger(NaiveBayesClassifier.class);

    private final DocumentTokenizer tokenizer;
    private final FrequencyStore store = new FrequencyStore();

    /**
     * Create an empty model splitting documents into n-grams.
     *
     * @param gramSize n-gram width, must be positive
     * @throws IllegalArgumentException if gramSize is not positive
     */
    public NaiveBayesClassifier(int gramSize) {
        this(new NGramTokenizer(gramSize));
    }

    /**
     * Create an empty model using a custom tokenizer.
     */
    public NaiveBayesClassifier(DocumentTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Add one training document for a category.
     * Repeated calls for the same category accumulate.
     */
    public void train(String document, String category) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(category, "category");

        Map<String, Integer> tokens = tokenizer.tokenize(document);
        store.addDocument(category, tokens);

        logger.debug("Trained category '{}' with {} distinct tokens (vocabulary: {})",
            category, tokens.size(), store.getVocabularySize());
    }

    /**
     * Assign a document to the best scoring category.
     * Ties go to the category trained first.
     *
     * @throws EmptyModelException if nothing has been trained yet
     */
    public String classify(String document) {
        String best = null;
        double max = Double.NEGATIVE_INFINITY;

        for (Map.Entry<String, Double> entry : scoreAll(document).entrySet()) {
            if (best == null || entry.getValue() > max) {
                max = entry.getValue();
                best = entry.getKey();
            }
        }
        return best;
    }

    /**
     * Score a document against every category, in first-training order.
     *
     * @throws EmptyModelException if nothing has been trained yet
     */
    public Map<String, Double> scoreAll(String document) {
        Objects.requireNonNull(document, "document");
        if (store.isEmpty()) {
            throw new EmptyModelException("Cannot classify: no categories have been trained");
        }

        Map<String, Integer> tokens = tokenizer.tokenize(document);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String category : store.getCategories()) {
            scores.put(category, score(tokens, category, categoryTokenTotal(category)));
        }
        return scores;
    }

    /**
     * Log-posterior score of tokenized document evidence for one category.
     *
     * @param documentTokens Token counts of the document being classified
     * @param category A trained category
     * @param categoryTokenTotal Result of {@link #categoryTokenTotal(String)} for the category
     */
    public double score(Map<String, Integer> documentTokens, String category, long categoryTokenTotal) {
        double s = Math.log((double) store.getDocumentCount(category) / store.getCategoryCount());

        double denominator = (double) categoryTokenTotal + store.getVocabularySize();
        if (denominator <= 0) {
            // Empty vocabulary: likelihood terms are identical for every category
            return s;
        }
        for (Map.Entry<String, Integer> entry : documentTokens.entrySet()) {
            double likelihood = (store.getTokenCount(category, entry.getKey()) + 1.0) / denominator;
            s += entry.getValue() * Math.log(likelihood);
        }
        return s;
    }

    /**
     * Total token occurrences recorded for a category (0 if unknown).
     */
    public long categoryTokenTotal(String category) {
        return store.getTokenTotal(category);
    }

    public Set<String> getCategories() {
        return store.getCategories();
    }

    public long getDocumentCount(String category) {
        return store.getDocumentCount(category);
    }

    public long getTokenCount(String category, String token) {
        return store.getTokenCount(category, token);
    }

    public int getVocabularySize() {
        return store.getVocabularySize();
    }

    public DocumentTokenizer getTokenizer() {
        return tokenizer;
    }
}
