package com.corpusindex.config;

/**
 * 单文档错误的处理策略：跳过该文档，或终止整个流水线。
 */
public enum ErrorPolicy {
    SKIP,
    FATAL
}
