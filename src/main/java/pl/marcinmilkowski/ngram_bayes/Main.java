package pl.marcinmilkowski.ngram_bayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ngram_bayes.corpus.TrainingSet;
import pl.marcinmilkowski.ngram_bayes.corpus.TrainingSetLoader;
import pl.marcinmilkowski.ngram_bayes.evaluation.EvaluationReport;
import pl.marcinmilkowski.ngram_bayes.evaluation.Evaluator;
import pl.marcinmilkowski.ngram_bayes.model.NaiveBayesClassifier;
import pl.marcinmilkowski.ngram_bayes.tokenize.AnalyzerTokenizer;
import pl.marcinmilkowski.ngram_bayes.tokenize.DocumentTokenizer;
import pl.marcinmilkowski.ngram_bayes.tokenize.NGramTokenizer;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: trains an n-gram Naive Bayes model from a
 * training-set manifest and reports how it classifies the validation file.
 *
 * Usage:
 *   java -jar ngram-bayes.jar manifest.tsv [n-gram-size] [--json] [--tokenizer ngram|words]
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        boolean json = false;
        String tokenizerName = "ngram";

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--json":
                        json = true;
                        break;
                    case "--tokenizer":
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--tokenizer requires a value");
                        }
                        tokenizerName = args[++i];
                        break;
                    case "help":
                    case "--help":
                        showUsage(out);
                        return EXIT_OK;
                    default:
                        if (args[i].startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                        }
                        positional.add(args[i]);
                }
            }

            if (positional.isEmpty() || positional.size() > 2) {
                showUsage(out);
                return EXIT_USAGE;
            }

            Integer gramSize = positional.size() > 1 ? parseGramSize(positional.get(1)) : null;
            DocumentTokenizer tokenizer = createTokenizer(tokenizerName, gramSize);

            TrainingSet trainingSet = new TrainingSetLoader().load(Paths.get(positional.get(0)));
            EvaluationReport report = new Evaluator().run(trainingSet, new NaiveBayesClassifier(tokenizer));

            if (json) {
                out.println(report.toJson().toJSONString());
            } else {
                printReport(report, out);
            }
            return EXIT_OK;
        } catch (Exception e) {
            logger.error("Application error", e);
            err.println("Error: " + e.getMessage());
            showUsage(err);
            return EXIT_ERROR;
        }
    }

    private static int parseGramSize(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid n-gram size: " + value, e);
        }
    }

    private static DocumentTokenizer createTokenizer(String name, Integer gramSize) {
        switch (name.toLowerCase()) {
            case "ngram":
                return new NGramTokenizer(gramSize != null ? gramSize : NGramTokenizer.DEFAULT_GRAM_SIZE);
            case "words":
                if (gramSize != null) {
                    throw new IllegalArgumentException("n-gram size does not apply to the words tokenizer");
                }
                return AnalyzerTokenizer.standard();
            default:
                throw new IllegalArgumentException("Unknown tokenizer: " + name);
        }
    }

    private static void printReport(EvaluationReport report, PrintStream out) {
        for (EvaluationReport.Outcome outcome : report.outcomes()) {
            out.printf("%-30s\t=> Response: %-6s (Correct: %s)%s%n",
                outcome.text(), outcome.predicted(), outcome.expected(), outcome.correct() ? "" : "*");
        }
        out.println();
        if (report.isAllCorrect()) {
            out.println("\tAll correct");
        } else {
            out.println("\t" + report.getErrorCount() + " errors");
        }
    }

    private static void showUsage(PrintStream out) {
        out.println("Usage: java -jar ngram-bayes.jar <manifest> [n-gram-size] [options]");
        out.println();
        out.println("Arguments:");
        out.println("  <manifest>       Tab-separated training-set manifest (locale, categories,");
        out.println("                   training files, validation file)");
        out.println("  [n-gram-size]    Characters per n-gram (default: " + NGramTokenizer.DEFAULT_GRAM_SIZE + ")");
        out.println();
        out.println("Options:");
        out.println("  --json                 Print the evaluation report as JSON");
        out.println("  --tokenizer <name>     ngram (default) or words (Lucene StandardAnalyzer,");
        out.println("                         takes no n-gram size)");
    }
}
