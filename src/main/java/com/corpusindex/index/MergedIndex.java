package com.corpusindex.index;

import com.corpusindex.pipeline.PipelineException;
import com.corpusindex.storage.BucketEntry;
import com.corpusindex.storage.Posting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 全局合并索引：按桶组织的词到倒排项映射。仅由合并线程访问。
 */
public final class MergedIndex {
    private final BucketPartitioner partitioner;
    private final Map<String, Bucket> bucketsByKey = new HashMap<>();
    private final Set<Integer> mergedDocIds = new HashSet<>();
    private final Set<Integer> skippedDocIds = new HashSet<>();
    private long residentPostingCount;

    public MergedIndex(BucketPartitioner partitioner) {
        this.partitioner = partitioner;
    }

    /**
     * 把一个文档片段并入索引：每个词追加该文档的倒排项。
     *
     * @throws PipelineException 文档已被合并或已被跳过
     */
    public void merge(InMemoryIndex fragment) {
        int docId = fragment.docId();
        requireUnseen(docId);
        mergedDocIds.add(docId);
        for (Map.Entry<String, int[]> entry : fragment.positionsByWord().entrySet()) {
            String word = entry.getKey();
            bucketsByKey.computeIfAbsent(partitioner.bucketKey(word), Bucket::new)
                .add(word, new Posting(docId, entry.getValue()));
            residentPostingCount++;
        }
    }

    /**
     * 按桶键升序取出每个桶内存中的有序词条，清空常驻倒排项。没有常驻词条的桶不出现在结果中。
     */
    public Map<String, List<BucketEntry>> drainResident() {
        List<Bucket> buckets = new ArrayList<>(bucketsByKey.values());
        buckets.sort(Comparator.comparing(Bucket::key));
        Map<String, List<BucketEntry>> drained = new LinkedHashMap<>();
        for (Bucket bucket : buckets) {
            if (bucket.residentPostingCount() > 0) {
                drained.put(bucket.key(), bucket.spill());
            }
        }
        residentPostingCount = 0;
        return drained;
    }

    /**
     * 内存中尚未溢写的倒排项总数。
     */
    public long residentPostingCount() {
        return residentPostingCount;
    }

    /**
     * 记录一个被跳过的文档。
     *
     * @throws PipelineException 文档已被合并或已被跳过
     */
    public void recordSkip(int docId) {
        requireUnseen(docId);
        skippedDocIds.add(docId);
    }

    /**
     * 关闭全部桶并按桶键升序返回。
     */
    public List<Bucket> closeAll() {
        List<Bucket> buckets = new ArrayList<>(bucketsByKey.values());
        buckets.sort(Comparator.comparing(Bucket::key));
        for (Bucket bucket : buckets) {
            if (bucket.state() == BucketState.OPEN) {
                bucket.close();
            }
        }
        return buckets;
    }

    public int mergedCount() {
        return mergedDocIds.size();
    }

    public int skippedCount() {
        return skippedDocIds.size();
    }

    public int bucketCount() {
        return bucketsByKey.size();
    }

    /**
     * 当前索引中的不同词数量，桶落盘后仍保留计数。
     * 发生溢写时，落盘前只统计内存中的词。
     */
    public int termCount() {
        int total = 0;
        for (Bucket bucket : bucketsByKey.values()) {
            total += bucket.wordCount();
        }
        return total;
    }

    private void requireUnseen(int docId) {
        if (mergedDocIds.contains(docId)) {
            throw PipelineException.mergeInvariant(docId, "文档 " + docId + " 已被合并过");
        }
        if (skippedDocIds.contains(docId)) {
            throw PipelineException.mergeInvariant(docId, "文档 " + docId + " 已被标记为跳过");
        }
    }
}
