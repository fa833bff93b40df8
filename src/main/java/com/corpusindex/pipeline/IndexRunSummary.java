package com.corpusindex.pipeline;

import com.corpusindex.index.MergeOutcome;
import com.corpusindex.index.SkippedDocument;
import com.corpusindex.storage.BucketMeta;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 一次索引运行的结果汇总。失败时 failure 非空，计数反映失败前的进度。
 */
public record IndexRunSummary(
    PipelineState state,
    int documentsEnumerated,
    int documentsIndexed,
    List<SkippedDocument> skipped,
    List<BucketMeta> flushedBuckets,
    int termCount,
    Instant startedAt,
    Instant finishedAt,
    FailureInfo failure
) {
    public IndexRunSummary {
        skipped = List.copyOf(skipped);
        flushedBuckets = List.copyOf(flushedBuckets);
    }

    static IndexRunSummary of(PipelineState state, int documentsEnumerated, MergeOutcome outcome,
                              PipelineException failure, Instant startedAt) {
        return new IndexRunSummary(
            state,
            documentsEnumerated,
            outcome.indexedCount(),
            outcome.skipped(),
            outcome.flushedBuckets(),
            outcome.termCount(),
            startedAt,
            Instant.now(),
            failure == null ? null : FailureInfo.from(failure)
        );
    }

    public boolean succeeded() {
        return state == PipelineState.COMPLETED;
    }

    public int skippedCount() {
        return skipped.size();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * 致命错误的可序列化描述。
     *
     * @param docId 出错文档 ID，无关时为 null
     * @param bucketKey 出错桶键，无关时为 null
     */
    public record FailureInfo(PipelineStage stage, String message, Integer docId, String bucketKey) {
        static FailureInfo from(PipelineException exception) {
            return new FailureInfo(
                exception.getStage(),
                exception.getMessage(),
                exception.getDocId().orElse(null),
                exception.getBucketKey().orElse(null)
            );
        }
    }
}
