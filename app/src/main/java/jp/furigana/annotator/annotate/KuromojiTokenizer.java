package jp.furigana.annotator.annotate;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Tokenizer} backed by the Kuromoji IPADIC analyzer.
 */
public class KuromojiTokenizer implements Tokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(KuromojiTokenizer.class);

    private final com.atilika.kuromoji.ipadic.Tokenizer delegate;

    public KuromojiTokenizer() {
        this.delegate = createDelegate();
    }

    KuromojiTokenizer(com.atilika.kuromoji.ipadic.Tokenizer delegate) {
        this.delegate = delegate;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<com.atilika.kuromoji.ipadic.Token> analyzed = delegate.tokenize(text);
        List<Token> tokens = new ArrayList<>(analyzed.size());
        for (com.atilika.kuromoji.ipadic.Token token : analyzed) {
            tokens.add(Token.of(token.getSurface(), token.getReading()));
        }
        return tokens;
    }

    private static com.atilika.kuromoji.ipadic.Tokenizer createDelegate() {
        try {
            long started = System.nanoTime();
            com.atilika.kuromoji.ipadic.Tokenizer tokenizer = new com.atilika.kuromoji.ipadic.Tokenizer();
            LOGGER.debug("Loaded Kuromoji IPADIC dictionary in {} ms", (System.nanoTime() - started) / 1_000_000);
            return tokenizer;
        } catch (RuntimeException | LinkageError ex) {
            throw new TokenizerException("Failed to initialize Kuromoji tokenizer", ex);
        }
    }
}
