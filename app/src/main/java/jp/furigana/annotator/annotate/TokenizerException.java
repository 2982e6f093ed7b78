package jp.furigana.annotator.annotate;

/**
 * Raised when the morphological analyzer cannot be initialised or used at all.
 */
public class TokenizerException extends RuntimeException {

    public TokenizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
