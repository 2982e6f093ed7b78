package jp.furigana.annotator.annotate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import jp.furigana.annotator.dictionary.NameDictionary;
import jp.furigana.annotator.script.ReadingConverter;
import jp.furigana.annotator.script.ScriptClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, token by token, whether plain text gets a furigana gloss and which reading it carries.
 * Author readings from the {@link NameDictionary} take precedence over the tokenizer.
 */
public class FuriganaAnnotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FuriganaAnnotator.class);

    private final Tokenizer tokenizer;
    private final NameDictionary nameDictionary;
    private final ProficiencyFilter proficiencyFilter;
    private final boolean preserveLongVowel;

    public FuriganaAnnotator(Tokenizer tokenizer, NameDictionary nameDictionary) {
        this(tokenizer, nameDictionary, ProficiencyFilter.elementary(), false);
    }

    public FuriganaAnnotator(Tokenizer tokenizer, NameDictionary nameDictionary,
                             ProficiencyFilter proficiencyFilter, boolean preserveLongVowel) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.nameDictionary = nameDictionary == null ? NameDictionary.empty() : nameDictionary;
        this.proficiencyFilter = Objects.requireNonNull(proficiencyFilter, "proficiencyFilter");
        this.preserveLongVowel = preserveLongVowel;
    }

    public List<AnnotatedSpan> annotate(String text, boolean filterMode) {
        if (text == null || text.isBlank()) {
            return text == null || text.isEmpty() ? List.of() : List.of(AnnotatedSpan.plain(text));
        }
        return annotate(text, tokenizer.tokenize(text), filterMode);
    }

    /**
     * Annotates {@code text} using tokens already produced for it. Concatenating the span bases gives back
     * {@code text} exactly: characters the tokens do not cover are emitted as plain spans in place.
     */
    public List<AnnotatedSpan> annotate(String text, List<Token> tokens, boolean filterMode) {
        Objects.requireNonNull(text, "text");
        List<AnnotatedSpan> spans = new ArrayList<>();
        int cursor = 0;
        for (Token token : tokens == null ? List.<Token>of() : tokens) {
            String surface = token.surface();
            if (surface.isEmpty()) {
                continue;
            }
            int position = text.indexOf(surface, cursor);
            if (position < 0) {
                LOGGER.debug("Token '{}' not found after offset {}; leaving it out", surface, cursor);
                continue;
            }
            if (position > cursor) {
                spans.add(AnnotatedSpan.plain(text.substring(cursor, position)));
            }
            spans.add(annotateToken(token, filterMode));
            cursor = position + surface.length();
        }
        if (cursor < text.length()) {
            spans.add(AnnotatedSpan.plain(text.substring(cursor)));
        }
        return spans;
    }

    public String annotateToMarkup(String text, boolean filterMode) {
        return render(annotate(text, filterMode));
    }

    public static String render(List<AnnotatedSpan> spans) {
        StringBuilder builder = new StringBuilder();
        for (AnnotatedSpan span : spans) {
            builder.append(span.markup());
        }
        return builder.toString();
    }

    AnnotatedSpan annotateToken(Token token, boolean filterMode) {
        String surface = token.surface();
        if (!ScriptClassifier.containsKanji(surface)) {
            return AnnotatedSpan.plain(surface);
        }
        Optional<String> reading = nameDictionary.reading(surface)
                .or(() -> token.tokenizerReading().map(value -> ReadingConverter.toHiragana(value, preserveLongVowel)));
        if (reading.isEmpty() || reading.get().isEmpty()) {
            return AnnotatedSpan.plain(surface);
        }
        if (filterMode && !proficiencyFilter.hasAdvancedKanji(surface)) {
            return AnnotatedSpan.plain(surface);
        }
        return AnnotatedSpan.ruby(surface, reading.get());
    }
}
