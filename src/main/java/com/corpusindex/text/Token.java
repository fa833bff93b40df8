package com.corpusindex.text;

/**
 * 一次词出现：归一化词项、文档内位置序号与原文字符偏移。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
}
