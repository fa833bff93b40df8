package com.corpusindex.document;

import java.io.IOException;
import java.util.Optional;

/**
 * 流水线入口：惰性、有限的文档序列，每个文档恰好产出一次。
 */
public interface DocumentSource {

    /**
     * 取出下一个文档。
     *
     * @return 下一个文档；序列结束时返回空
     * @throws IOException 无法列出某个路径时抛出，序列随之终止
     */
    Optional<Document> next() throws IOException;
}
