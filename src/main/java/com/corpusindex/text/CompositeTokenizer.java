package com.corpusindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 可选的 CJK 双字规则。
 *
 * 词的切分与 {@link AlphanumericTokenizer} 相同；词内部在 CJK 与非 CJK 码点交界处再切开，
 * 非 CJK 片段整体成词，CJK 片段按码点输出重叠双字，单个 CJK 码点原样输出。
 * 所有片段经同一个 {@link TermNormalizer} 过滤，位置序号在整篇文本内连续。
 */
public class CompositeTokenizer implements Tokenizer {

    private final TermNormalizer normalizer;

    public CompositeTokenizer(boolean enableStopWords, int minTermLength) {
        this(TermNormalizer.of(enableStopWords, minTermLength));
    }

    public CompositeTokenizer(TermNormalizer normalizer) {
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
            boolean cjk = TermNormalizer.isCjk(codePoint);
            int runStart = cursor;
            while (cursor < text.length()) {
                int current = text.codePointAt(cursor);
                if (!TermNormalizer.isWordCodePoint(current) || TermNormalizer.isCjk(current) != cjk) {
                    break;
                }
                cursor += Character.charCount(current);
            }
            if (cjk) {
                appendBigrams(text, runStart, cursor, tokens);
            } else {
                append(text, runStart, cursor, tokens);
            }
        }

        return List.copyOf(tokens);
    }

    private void appendBigrams(String text, int runStart, int runEnd, List<Token> tokens) {
        int second = text.offsetByCodePoints(runStart, 1);
        if (second >= runEnd) {
            append(text, runStart, runEnd, tokens);
            return;
        }
        int first = runStart;
        while (second < runEnd) {
            int end = second + Character.charCount(text.codePointAt(second));
            append(text, first, end, tokens);
            first = second;
            second = end;
        }
    }

    private void append(String text, int start, int end, List<Token> tokens) {
        String term = normalizer.normalize(text, start, end);
        if (term != null) {
            tokens.add(new Token(term, tokens.size(), start, end));
        }
    }
}
