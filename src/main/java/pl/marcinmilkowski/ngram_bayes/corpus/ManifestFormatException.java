package pl.marcinmilkowski.ngram_bayes.corpus;

/**
 * Exception thrown when a training-set manifest or one of its data files is malformed.
 */
public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message) {
        super(message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
