package com.corpusindex.text;

import java.util.List;

/**
 * 归一化分词规则。实现必须无状态且线程安全，多个分词线程共享同一实例。
 */
public interface Tokenizer {

    /**
     * 将输入文本切分为归一化后的词项列表，相同输入总是得到相同输出。
     */
    List<Token> tokenize(String text);
}
