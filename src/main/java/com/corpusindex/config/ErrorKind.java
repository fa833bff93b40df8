package com.corpusindex.config;

/**
 * 单文档读取失败的分类。
 */
public enum ErrorKind {
    NOT_FOUND,
    PERMISSION_DENIED,
    IO_ERROR,
    DECODE_ERROR,
    OUT_OF_MEMORY
}
