package com.corpusindex.storage;

/**
 * 已落盘桶的元数据，写入索引清单。
 *
 * @param bucketKey 桶键（词的前缀）
 * @param fileName 桶文件名，相对于输出目录
 * @param termCount 词数量
 * @param postingCount 倒排项总数
 * @param sizeBytes 文件字节数（含 CRC 页脚）
 * @param crc32 数据区 CRC32
 */
public record BucketMeta(
    String bucketKey,
    String fileName,
    int termCount,
    long postingCount,
    long sizeBytes,
    long crc32
) {
}
