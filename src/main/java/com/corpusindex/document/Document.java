package com.corpusindex.document;

import java.nio.file.Path;

/**
 * 待索引文档。ID 在枚举时分配，单调递增且同一次运行内不复用。
 *
 * @param docId 文档 ID
 * @param path 文档路径
 * @param sizeBytes 枚举时记录的字节长度
 */
public record Document(int docId, Path path, long sizeBytes) {

    /**
     * 毒丸对象，用于通知分词线程输入结束
     */
    public static final Document POISON = new Document(-1, Path.of("__POISON__"), -1);

    public Document {
        if (path == null) {
            throw new IllegalArgumentException("文档路径不能为空");
        }
    }

    public boolean isPoison() {
        return this == POISON;
    }
}
