package com.corpusindex.index;

import com.corpusindex.config.ErrorKind;

import java.nio.file.Path;

/**
 * 被跳过的文档及原因。
 */
public record SkippedDocument(int docId, Path path, ErrorKind errorKind, String reason) {
}
