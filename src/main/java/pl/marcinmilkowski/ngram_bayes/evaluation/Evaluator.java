package pl.marcinmilkowski.ngram_bayes.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ngram_bayes.corpus.TrainingSet;
import pl.marcinmilkowski.ngram_bayes.model.NaiveBayesClassifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Trains a classifier on a {@link TrainingSet} and replays its validation samples.
 */
public class Evaluator {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Train the model with one document per category (categories without
     * training text are skipped), then classify every validation sample.
     *
     * @param trainingSet Loaded training material
     * @param classifier An empty or partially trained model
     * @return Per-sample outcomes
     */
    public EvaluationReport run(TrainingSet trainingSet, NaiveBayesClassifier classifier) {
        for (String category : trainingSet.categories()) {
            String text = trainingSet.trainingTexts().get(category);
            if (text == null) {
                logger.warn("No training text for category '{}', skipping", category);
                continue;
            }
            classifier.train(text, category);
        }
        logger.info("Trained {} categories, vocabulary size {}",
            classifier.getCategories().size(), classifier.getVocabularySize());

        List<EvaluationReport.Outcome> outcomes = new ArrayList<>();
        for (TrainingSet.ValidationSample sample : trainingSet.validationSamples()) {
            String predicted = classifier.classify(sample.text());
            outcomes.add(new EvaluationReport.Outcome(sample.text(), predicted, trainingSet.expectedCategory(sample)));
        }

        EvaluationReport report = new EvaluationReport(classifier.getTokenizer().getName(), outcomes);
        logger.info("Classified {} validation samples, {} errors", outcomes.size(), report.getErrorCount());
        return report;
    }
}
