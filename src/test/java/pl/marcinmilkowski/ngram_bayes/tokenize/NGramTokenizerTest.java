package pl.marcinmilkowski.ngram_bayes.tokenize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NGramTokenizer.
 */
class NGramTokenizerTest {

    @Test
    void testOverlappingBigrams() {
        Map<String, Integer> tokens = new NGramTokenizer(2).tokenize("abcab");

        assertEquals(3, tokens.size());
        assertEquals(2, tokens.get("ab"));
        assertEquals(1, tokens.get("bc"));
        assertEquals(1, tokens.get("ca"));
    }

    @Test
    @DisplayName("Document of length L yields L - n + 1 windows of length n")
    void testWindowCount() {
        String document = "the quick brown fox jumps over the lazy dog";
        for (int n = 1; n <= 5; n++) {
            Map<String, Integer> tokens = new NGramTokenizer(n).tokenize(document);

            int total = tokens.values().stream().mapToInt(Integer::intValue).sum();
            assertEquals(document.length() - n + 1, total, "window count for n=" + n);
            for (String token : tokens.keySet()) {
                assertEquals(n, token.length());
            }
        }
    }

    @Test
    void testDocumentShorterThanGram() {
        assertTrue(new NGramTokenizer(3).tokenize("ab").isEmpty());
    }

    @Test
    void testEmptyDocument() {
        assertTrue(new NGramTokenizer(1).tokenize("").isEmpty());
    }

    @Test
    void testDocumentEqualToGram() {
        Map<String, Integer> tokens = new NGramTokenizer(3).tokenize("abc");
        assertEquals(Map.of("abc", 1), tokens);
    }

    @Test
    @DisplayName("Text without word boundaries is split the same way")
    void testJapaneseText() {
        Map<String, Integer> tokens = new NGramTokenizer(2).tokenize("こんにちは");

        assertEquals(4, tokens.size());
        assertTrue(tokens.containsKey("こん"));
        assertTrue(tokens.containsKey("ちは"));
    }

    @Test
    void testRejectsNonPositiveGramSize() {
        assertThrows(IllegalArgumentException.class, () -> new NGramTokenizer(0));
        assertThrows(IllegalArgumentException.class, () -> new NGramTokenizer(-3));
    }

    @Test
    void testDefaultGramSize() {
        assertEquals(2, new NGramTokenizer().getGramSize());
        assertEquals("2-gram", new NGramTokenizer().getName());
    }

    @Test
    void testNullDocument() {
        assertThrows(NullPointerException.class, () -> new NGramTokenizer(2).tokenize(null));
    }
}
