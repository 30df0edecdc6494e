package pl.marcinmilkowski.ngram_bayes;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the command-line entry point.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private Path manifest;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("train.txt"), "abcabcabc\nxyzxyzxyz\n");
        Files.writeString(tempDir.resolve("validate.txt"), "0\tabcab\n1\txyzx\n");
        manifest = tempDir.resolve("set.tsv");
        Files.writeString(manifest, "en_US.UTF-8\nA\tB\ntrain.txt\nvalidate.txt\n");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testAllCorrect() {
        assertEquals(Main.EXIT_OK, run(manifest.toString()));

        String output = stdout();
        assertTrue(output.contains("=> Response: A"));
        assertTrue(output.contains("(Correct: B)"));
        assertTrue(output.contains("All correct"));
        assertFalse(output.contains("*"));
    }

    @Test
    void testReportsErrors() throws IOException {
        Files.writeString(tempDir.resolve("validate.txt"), "0\tabcab\n0\txyz\n");

        assertEquals(Main.EXIT_OK, run(manifest.toString(), "2"));

        String output = stdout();
        assertTrue(output.contains("(Correct: A)*"));
        assertTrue(output.contains("1 errors"));
    }

    @Test
    void testJsonOutput() {
        assertEquals(Main.EXIT_OK, run(manifest.toString(), "3", "--json"));

        JSONObject json = JSON.parseObject(stdout().trim());
        assertEquals("3-gram", json.getString("tokenizer"));
        assertEquals(2, json.getIntValue("samples"));
    }

    @Test
    void testNoArgumentsShowsUsage() {
        assertEquals(Main.EXIT_USAGE, run());
        assertTrue(stdout().startsWith("Usage:"));
    }

    @Test
    void testTooManyArguments() {
        assertEquals(Main.EXIT_USAGE, run(manifest.toString(), "2", "extra"));
    }

    @Test
    void testInvalidGramSize() {
        assertEquals(Main.EXIT_ERROR, run(manifest.toString(), "0"));
        assertTrue(stderr().startsWith("Error: n-gram size must be positive"));
    }

    @Test
    void testNonNumericGramSize() {
        assertEquals(Main.EXIT_ERROR, run(manifest.toString(), "two"));
        assertTrue(stderr().contains("Invalid n-gram size: two"));
    }

    @Test
    void testMissingManifest() {
        assertEquals(Main.EXIT_ERROR, run(tempDir.resolve("missing.tsv").toString()));
        assertTrue(stderr().contains("Failed to open file"));
    }

    @Test
    void testWordsTokenizerRejectsGramSize() {
        assertEquals(Main.EXIT_ERROR, run(manifest.toString(), "0", "--tokenizer", "words"));
        assertTrue(stderr().contains("n-gram size does not apply to the words tokenizer"));
    }

    @Test
    void testWordsTokenizer() {
        assertEquals(Main.EXIT_OK, run(manifest.toString(), "--tokenizer", "words", "--json"));

        JSONObject json = JSON.parseObject(stdout().trim());
        assertEquals("lucene:StandardAnalyzer", json.getString("tokenizer"));
    }

    @Test
    void testUnknownOption() {
        assertEquals(Main.EXIT_ERROR, run(manifest.toString(), "--verbose"));
        assertTrue(stderr().contains("Unknown option: --verbose"));
    }
}
