package com.corpusindex.index;

/**
 * 桶生命周期：OPEN 接收倒排，CLOSED 不再接收，FLUSHED 已落盘并释放内存。
 */
public enum BucketState {
    OPEN,
    CLOSED,
    FLUSHED
}
