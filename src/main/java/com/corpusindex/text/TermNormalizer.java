package com.corpusindex.text;

import java.util.Locale;

/**
 * 词项归一化规则，各分词器共用。
 *
 * 同一原文片段总是得到同一个词项：按 Locale.ROOT 转小写，
 * 不依赖运行环境的默认区域设置。短于最短词长或命中停用词表的词项被丢弃，
 * 丢弃的词项不占用位置序号。
 */
public final class TermNormalizer {

    private final StopWords stopWords;
    private final int minTermLength;

    public TermNormalizer(StopWords stopWords, int minTermLength) {
        if (stopWords == null) {
            throw new IllegalArgumentException("stopWords 不能为空");
        }
        if (minTermLength < 1) {
            throw new IllegalArgumentException("minTermLength 必须 >= 1: " + minTermLength);
        }
        this.stopWords = stopWords;
        this.minTermLength = minTermLength;
    }

    /**
     * 按开关选用内置英文停用词表。
     */
    public static TermNormalizer of(boolean enableStopWords, int minTermLength) {
        return new TermNormalizer(enableStopWords ? StopWords.english() : StopWords.none(), minTermLength);
    }

    /**
     * 归一化原文片段，被过滤时返回 null。
     */
    public String normalize(CharSequence raw, int start, int end) {
        String term = raw.subSequence(start, end).toString().toLowerCase(Locale.ROOT);
        if (term.codePointCount(0, term.length()) < minTermLength) {
            return null;
        }
        if (stopWords.contains(term)) {
            return null;
        }
        return term;
    }

    public int getMinTermLength() {
        return minTermLength;
    }

    public StopWords getStopWords() {
        return stopWords;
    }

    /**
     * 词字符：Unicode 字母、十进制数字、字母数字（如罗马数字）和其他数字（如上标）。
     */
    static boolean isWordCodePoint(int codePoint) {
        if (Character.isLetter(codePoint) || Character.isDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

    /**
     * 汉字、平假名、片假名或谚文码点。
     */
    static boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.HANGUL;
    }
}
