package jp.furigana.annotator.annotate;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import jp.furigana.annotator.script.ScriptClassifier;

/**
 * Set of elementary kanji a reader is assumed to know. Surfaces made only of these kanji are left unglossed
 * when filtering is enabled.
 */
public final class ProficiencyFilter {

    // JLPT N4 and below
    private static final String ELEMENTARY_KANJI =
            "一二三四五六七八九十百千万"
            + "日月火水木金土年今毎先来何時分半"
            + "人男女子学生友私父母兄姉弟妹家族"
            + "本名前国語文字会社話読書見聞言食飲"
            + "行帰入出休立座歩走作使働買売"
            + "大小多少高安低長短新古若明暗白黒"
            + "赤青色好悪元気有無便利不正間違"
            + "右左上下中外内後東西南北近遠"
            + "山川田町村市駅校店車道門室開閉"
            + "天雨雪花草林森犬猫魚鳥肉米茶"
            + "朝昼夜晩午早遅週円度回番方力勉強"
            + "思知考教習問答理解同意味物品者"
            + "手足目耳口体頭顔心声電写真切持"
            + "貸借送返起寝着脱洗待取付始終住";

    private static final ProficiencyFilter ELEMENTARY = of(ELEMENTARY_KANJI);

    private final Set<Integer> knownKanji;

    private ProficiencyFilter(Set<Integer> knownKanji) {
        this.knownKanji = Set.copyOf(knownKanji);
    }

    public static ProficiencyFilter elementary() {
        return ELEMENTARY;
    }

    public static ProficiencyFilter of(String knownKanji) {
        Objects.requireNonNull(knownKanji, "knownKanji");
        return new ProficiencyFilter(knownKanji.codePoints().boxed().collect(Collectors.toSet()));
    }

    public boolean isElementary(int codePoint) {
        return knownKanji.contains(codePoint);
    }

    /**
     * Whether the surface holds at least one kanji outside the elementary set.
     */
    public boolean hasAdvancedKanji(String surface) {
        return surface.codePoints().anyMatch(cp -> ScriptClassifier.isKanji(cp) && !isElementary(cp));
    }

    public int size() {
        return knownKanji.size();
    }
}
