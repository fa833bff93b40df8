package com.corpusindex.text;

import com.corpusindex.config.IndexerConfig;

/**
 * 按配置构造归一化分词规则。
 */
public final class TokenizerFactory {

    private TokenizerFactory() {
    }

    public static Tokenizer fromConfig(IndexerConfig config) {
        TermNormalizer normalizer = normalizerFor(config);
        return switch (config.getTokenizerMode()) {
            case ENGLISH -> new AlphanumericTokenizer(normalizer);
            case COMPOSITE -> new CompositeTokenizer(normalizer);
        };
    }

    /**
     * 停用词开关打开时优先使用配置中的自定义词表，未配置则用内置英文词表。
     */
    static TermNormalizer normalizerFor(IndexerConfig config) {
        StopWords stopWords = StopWords.none();
        if (config.isEnableStopWords()) {
            stopWords = config.getStopWords().isEmpty()
                ? StopWords.english()
                : StopWords.of(config.getStopWords());
        }
        return new TermNormalizer(stopWords, config.getMinTermLength());
    }
}
