package pl.marcinmilkowski.ngram_bayes.model;

/**
 * Exception thrown when a model is asked to classify before any training.
 */
public class EmptyModelException extends IllegalStateException {

    public EmptyModelException(String message) {
        super(message);
    }
}
