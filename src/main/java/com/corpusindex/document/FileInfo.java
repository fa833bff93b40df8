package com.corpusindex.document;

import java.nio.file.Path;

/**
 * 文件树遍历产出的文件信息记录
 */
public record FileInfo(Path path, long sizeBytes) {
}
