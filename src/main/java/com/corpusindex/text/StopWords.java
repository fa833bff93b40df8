package com.corpusindex.text;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * 不可变停用词表。
 *
 * 词表在构造时按 Locale.ROOT 转小写，与词项归一化规则一致，
 * 因此查询时直接比较归一化后的词项即可。
 */
public final class StopWords {

    private static final StopWords NONE = new StopWords(Set.of());

    private static final StopWords ENGLISH = of(Set.of(
        "a", "an", "and", "are", "as", "at", "be", "been", "but", "by",
        "for", "from", "had", "has", "have", "he", "her", "his", "i", "if",
        "in", "into", "is", "it", "its", "of", "on", "or", "our", "she",
        "so", "such", "than", "that", "the", "their", "then", "there", "these", "they",
        "this", "to", "was", "we", "were", "will", "with", "you", "your"
    ));

    private final Set<String> words;

    private StopWords(Set<String> words) {
        this.words = words;
    }

    /**
     * 内置英文停用词表。
     */
    public static StopWords english() {
        return ENGLISH;
    }

    /**
     * 空词表，不过滤任何词项。
     */
    public static StopWords none() {
        return NONE;
    }

    /**
     * 以自定义词表构造，忽略空白项。
     */
    public static StopWords of(Collection<String> words) {
        if (words == null) {
            throw new IllegalArgumentException("停用词表不能为空");
        }
        Set<String> folded = new TreeSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                folded.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new StopWords(Set.copyOf(folded));
    }

    public boolean contains(String normalizedTerm) {
        return normalizedTerm != null && words.contains(normalizedTerm);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }
}
