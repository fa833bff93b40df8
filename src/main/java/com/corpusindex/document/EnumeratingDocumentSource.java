package com.corpusindex.document;

import com.corpusindex.config.Constants;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Optional;

/**
 * 将外部提供的文件序列包装为文档源，并在枚举时分配文档 ID。
 *
 * 非线程安全：同一时刻只允许一个投喂线程调用 {@link #next()}。
 */
public final class EnumeratingDocumentSource implements DocumentSource {
    private final Iterable<FileInfo> files;
    private Iterator<FileInfo> iterator;
    private int nextDocId;
    private boolean exhausted;

    public EnumeratingDocumentSource(Iterable<FileInfo> files) {
        if (files == null) {
            throw new IllegalArgumentException("文件序列不能为空");
        }
        this.files = files;
        restart();
    }

    /**
     * 从头开始新一轮枚举，文档 ID 重新从 {@link Constants#FIRST_DOC_ID} 分配。
     */
    public void restart() {
        this.iterator = null;
        this.nextDocId = Constants.FIRST_DOC_ID;
        this.exhausted = false;
    }

    @Override
    public Optional<Document> next() throws IOException {
        if (exhausted) {
            return Optional.empty();
        }
        try {
            if (iterator == null) {
                iterator = files.iterator();
            }
            if (!iterator.hasNext()) {
                exhausted = true;
                return Optional.empty();
            }
            FileInfo fileInfo = iterator.next();
            return Optional.of(new Document(nextDocId++, fileInfo.path(), fileInfo.sizeBytes()));
        } catch (UncheckedIOException exception) {
            exhausted = true;
            throw new IOException(exception.getMessage(), exception.getCause());
        }
    }

    /**
     * 已分配的文档数量。
     */
    public int enumeratedCount() {
        return nextDocId - Constants.FIRST_DOC_ID;
    }
}
