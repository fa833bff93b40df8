package com.corpusindex.config;

/**
 * 分词模式。
 */
public enum TokenizerMode {
    /** 默认：连续字母数字成词，CJK 连续片段整体成词 */
    ENGLISH,
    /** 可选：在默认规则上把 CJK 片段切成重叠双字 */
    COMPOSITE
}
