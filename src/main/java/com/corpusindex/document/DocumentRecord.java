package com.corpusindex.document;

import java.nio.file.Path;

/**
 * 文档目录中的一行：文档元数据与本次运行的处理结果。
 *
 * @param reason 跳过原因，已索引文档为 null
 * @param tokenCount 词出现总数，跳过的文档为 0
 */
public record DocumentRecord(
        int docId,
        Path path,
        long sizeBytes,
        DocumentStatus status,
        String reason,
        int tokenCount
) {
    public static DocumentRecord indexed(Document document, int tokenCount) {
        return new DocumentRecord(document.docId(), document.path(), document.sizeBytes(),
                DocumentStatus.INDEXED, null, tokenCount);
    }

    public static DocumentRecord skipped(Document document, String reason) {
        return new DocumentRecord(document.docId(), document.path(), document.sizeBytes(),
                DocumentStatus.SKIPPED, reason, 0);
    }
}
