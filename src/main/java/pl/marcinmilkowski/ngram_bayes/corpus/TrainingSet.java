package pl.marcinmilkowski.ngram_bayes.corpus;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded training material: category labels, one concatenated training text
 * per category and labelled validation documents.
 */
public record TrainingSet(
    String localeName,
    Charset charset,
    List<String> categories,
    Map<String, String> trainingTexts,
    List<ValidationSample> validationSamples
) {
    public TrainingSet {
        categories = List.copyOf(categories);
        trainingTexts = Collections.unmodifiableMap(new LinkedHashMap<>(trainingTexts));
        validationSamples = List.copyOf(validationSamples);
    }

    /**
     * Label of the category a validation sample is expected to land in.
     */
    public String expectedCategory(ValidationSample sample) {
        return categories.get(sample.categoryIndex());
    }

    /**
     * One validation document with the index of its true category.
     */
    public record ValidationSample(int categoryIndex, String text) {
    }
}
