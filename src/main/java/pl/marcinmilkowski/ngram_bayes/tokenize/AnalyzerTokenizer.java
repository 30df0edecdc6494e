package pl.marcinmilkowski.ngram_bayes.tokenize;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Word-level tokenizer backed by a Lucene {@link Analyzer}.
 *
 * Drop-in replacement for {@link NGramTokenizer} when the input language has
 * reliable word boundaries. The analyzer decides segmentation and
 * normalisation (StandardAnalyzer lowercases and splits on Unicode word breaks).
 */
public class AnalyzerTokenizer implements DocumentTokenizer {

    private static final String FIELD = "text";

    private final Analyzer analyzer;

    public AnalyzerTokenizer(Analyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public static AnalyzerTokenizer standard() {
        return new AnalyzerTokenizer(new StandardAnalyzer());
    }

    @Override
    public Map<String, Integer> tokenize(String document) {
        Objects.requireNonNull(document, "document");
        Map<String, Integer> counts = new HashMap<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, document)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                counts.merge(term.toString(), 1, Integer::sum);
            }
            stream.end();
        } catch (IOException e) {
            // StringReader input: only reachable through a broken analyzer chain
            throw new UncheckedIOException("Analyzer failed on in-memory document", e);
        }
        return counts;
    }

    @Override
    public String getName() {
        return "lucene:" + analyzer.getClass().getSimpleName();
    }
}
