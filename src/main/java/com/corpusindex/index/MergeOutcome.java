package com.corpusindex.index;

import com.corpusindex.storage.BucketMeta;

import java.util.List;

/**
 * 合并线程的运行结果；失败时反映失败前已完成的进度。
 *
 * @param indexedCount 已合并的文档数
 * @param skipped 已跳过的文档
 * @param flushedBuckets 已落盘的桶，按桶键升序
 * @param termCount 不同词数量
 * @param committed 清单与文档目录是否已提交
 */
public record MergeOutcome(
    int indexedCount,
    List<SkippedDocument> skipped,
    List<BucketMeta> flushedBuckets,
    int termCount,
    boolean committed
) {
    public MergeOutcome {
        skipped = List.copyOf(skipped);
        flushedBuckets = List.copyOf(flushedBuckets);
    }

    public static MergeOutcome empty() {
        return new MergeOutcome(0, List.of(), List.of(), 0, false);
    }
}
