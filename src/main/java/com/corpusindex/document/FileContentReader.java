package com.corpusindex.document;

import java.io.IOException;
import java.nio.file.Files;

/**
 * 直接从文件系统读取文档内容。
 */
public final class FileContentReader implements ContentReader {

    @Override
    public byte[] read(Document document) throws IOException {
        return Files.readAllBytes(document.path());
    }
}
