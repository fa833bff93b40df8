package com.corpusindex.document;

import java.io.IOException;

/**
 * 文档内容读取边界（打开-读取-关闭）。
 */
@FunctionalInterface
public interface ContentReader {

    /**
     * 读取文档的全部字节。
     *
     * @param document 目标文档
     * @return 文档内容
     * @throws IOException 文件不存在、无权限或读取失败时抛出
     */
    byte[] read(Document document) throws IOException;
}
