package com.corpusindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 默认分词规则：连续词字符组成一个词，其余字符均为分隔符。
 *
 * CJK 连续片段同样整体成词，例如 "索引流水线" 是一个词项。
 */
public class AlphanumericTokenizer implements Tokenizer {

    private final TermNormalizer normalizer;

    /**
     * 创建字母数字分词器。
     *
     * @param enableStopWords 是否过滤内置英文停用词
     * @param minTermLength 最短词长（码点数），短于此长度的词被丢弃
     */
    public AlphanumericTokenizer(boolean enableStopWords, int minTermLength) {
        this(TermNormalizer.of(enableStopWords, minTermLength));
    }

    public AlphanumericTokenizer(TermNormalizer normalizer) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer 不能为空");
        }
        this.normalizer = normalizer;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (!TermNormalizer.isWordCodePoint(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }
            int wordStart = cursor;
            while (cursor < text.length()) {
                int current = text.codePointAt(cursor);
                if (!TermNormalizer.isWordCodePoint(current)) {
                    break;
                }
                cursor += Character.charCount(current);
            }
            String term = normalizer.normalize(text, wordStart, cursor);
            if (term != null) {
                tokens.add(new Token(term, tokens.size(), wordStart, cursor));
            }
        }

        return List.copyOf(tokens);
    }
}
