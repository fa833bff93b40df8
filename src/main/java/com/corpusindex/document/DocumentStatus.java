package com.corpusindex.document;

/**
 * 文档在一次索引运行中的最终状态。
 */
public enum DocumentStatus {
    INDEXED,
    SKIPPED
}
