package com.corpusindex.storage;

import com.corpusindex.document.DocumentRecord;

import java.io.IOException;
import java.util.List;

/**
 * 桶持久化接口。
 *
 * 一个桶要么完整写入，要么不存在；{@link #write} 抛出异常时不得留下该桶的任何产物。
 */
public interface BucketStore {

    /**
     * 在一次运行开始前准备输出位置，清理上次运行遗留的产物。
     */
    void prepare() throws IOException;

    /**
     * 原子写入一个已排序的桶。
     *
     * @param bucketKey 桶键
     * @param entries 按词序排列的词条
     * @return 落盘后的桶元数据
     */
    BucketMeta write(String bucketKey, List<BucketEntry> entries) throws IOException;

    /**
     * 全部桶落盘后写入文档目录与索引清单。
     */
    void commit(IndexManifest manifest, List<DocumentRecord> documents) throws IOException;
}
