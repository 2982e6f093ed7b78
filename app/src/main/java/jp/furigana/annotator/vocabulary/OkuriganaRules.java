package jp.furigana.annotator.vocabulary;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tables used to decide how much trailing kana belongs to a ruby-annotated stem.
 *
 * @param endings inflectional endings that may follow a kanji stem
 * @param particles kana that are never taken as a single-character ending
 * @param volitionalStems final base characters after which a lone {@code う} is a volitional ending
 */
public record OkuriganaRules(Set<String> endings, Set<String> particles, Set<String> volitionalStems) {

    private static final List<String> DEFAULT_ENDINGS = List.of(
            // adjectives, literary forms and noun-forming suffixes
            "しい", "かい", "がい", "さい", "ない", "らい", "ゆい", "くい", "ぐい",
            "き", "け", "さ", "み", "げ",
            // te/ta forms
            "った", "って", "んだ", "んで", "いた", "いて", "いだ", "いで",
            "した", "して", "きた", "きて",
            // polite, passive, causative, negative, desiderative, volitional
            "ます", "ません", "ました", "ましょう",
            "れる", "られる", "せる", "させる",
            "なかった", "なく", "ず",
            "たい", "たく",
            "こう", "そう", "よう", "まい",
            // ichidan and godan tails
            "える", "ける", "てる", "ねる", "べる", "める", "げる", "でる",
            "いる", "きる", "じる", "ちる", "にる", "ひる", "びる", "みる", "りる",
            "わる", "ある", "うる", "おる",
            // single-character fallbacks
            "い", "し", "ち", "り", "え", "れ",
            "め", "た", "て", "だ", "で", "せ", "べ", "ね",
            "ひ", "び", "ぎ", "じ", "ぴ", "ぢ",
            "る", "く", "ぐ", "す", "つ", "ぬ", "ぶ", "む", "う");

    private static final List<String> DEFAULT_PARTICLES = List.of(
            "は", "が", "を", "に", "で", "と", "も", "の", "へ", "や",
            "か", "ね", "よ", "わ", "ば", "ら", "ぜ", "ぞ", "さ",
            "より", "から", "など", "まで", "だけ", "ほど", "くらい", "ばかり");

    private static final OkuriganaRules DEFAULTS = new OkuriganaRules(
            Set.copyOf(DEFAULT_ENDINGS), Set.copyOf(DEFAULT_PARTICLES), Set.of("こ", "そ", "よ", "ろ"));

    public OkuriganaRules {
        endings = Set.copyOf(Objects.requireNonNull(endings, "endings"));
        particles = Set.copyOf(Objects.requireNonNull(particles, "particles"));
        volitionalStems = Set.copyOf(Objects.requireNonNull(volitionalStems, "volitionalStems"));
    }

    public static OkuriganaRules defaults() {
        return DEFAULTS;
    }

    public boolean isEnding(String candidate) {
        return endings.contains(candidate);
    }

    public boolean isParticle(String candidate) {
        return particles.contains(candidate);
    }

    public boolean isVolitionalStem(String character) {
        return volitionalStems.contains(character);
    }
}
