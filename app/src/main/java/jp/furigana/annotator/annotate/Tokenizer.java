package jp.furigana.annotator.annotate;

import java.util.List;

/**
 * Morphological analyzer boundary: surface text in, tokens out.
 */
@FunctionalInterface
public interface Tokenizer {

    List<Token> tokenize(String text);
}
