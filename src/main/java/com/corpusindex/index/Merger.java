package com.corpusindex.index;

import com.corpusindex.config.Constants;
import com.corpusindex.config.IndexerConfig;
import com.corpusindex.document.DocumentRecord;
import com.corpusindex.pipeline.BoundedChannel;
import com.corpusindex.pipeline.FatalErrorSlot;
import com.corpusindex.pipeline.PipelineException;
import com.corpusindex.pipeline.PipelineStage;
import com.corpusindex.storage.BucketEntry;
import com.corpusindex.storage.BucketMeta;
import com.corpusindex.storage.BucketStore;
import com.corpusindex.storage.IndexManifest;
import com.corpusindex.storage.SpillStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 合并器：把片段并入合并索引，全部输入结束后按桶键升序逐桶落盘并提交索引。
 *
 * 流水线模式下由合并线程调用 {@link #drain}；单线程模式下由调用方逐条 {@link #accept} 后调用 {@link #finish}。
 * 常驻倒排项达到溢写阈值时，把全部桶的内存词条写成溢写段，落盘前再按桶归并。
 * 实例只属于一个线程。
 */
public final class Merger {
    private static final Logger logger = LoggerFactory.getLogger(Merger.class);

    private final BucketStore bucketStore;
    private final IndexerConfig config;
    private final FatalErrorSlot errorSlot;
    private final MergedIndex mergedIndex;
    private final List<DocumentRecord> documentRecords = new ArrayList<>();
    private final List<SkippedDocument> skippedDocuments = new ArrayList<>();
    private final List<BucketMeta> flushedBuckets = new ArrayList<>();
    private final SpillStore spillStore;
    private final Map<String, List<Path>> runsByKey = new HashMap<>();
    private int spillCount;
    private boolean committed;

    public Merger(BucketStore bucketStore, IndexerConfig config, FatalErrorSlot errorSlot) {
        this(bucketStore, config, errorSlot, SpillStore.forOutputDir(config.getOutputDir()));
    }

    public Merger(BucketStore bucketStore, IndexerConfig config, FatalErrorSlot errorSlot, SpillStore spillStore) {
        this.bucketStore = bucketStore;
        this.config = config;
        this.errorSlot = errorSlot;
        this.spillStore = spillStore;
        this.mergedIndex = new MergedIndex(new BucketPartitioner(config.getBucketPrefixLength()));
    }

    /**
     * 持续消费片段队列，直到收到全部分词线程的完成通知后落盘提交。
     * 致命错误写入错误槽，不向外抛出。
     *
     * @param fragmentQueue 片段队列
     * @param producerCount 分词线程数
     * @return 合并结果
     */
    public MergeOutcome drain(BoundedChannel<FragmentMessage> fragmentQueue, int producerCount) {
        int finishedProducers = 0;
        try {
            while (finishedProducers < producerCount) {
                FragmentMessage message = fragmentQueue.receive();
                if (message == null) {
                    if (!errorSlot.isSet()) {
                        errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR, "合并线程等待片段时被中断", null));
                    }
                    return outcome();
                }
                if (message instanceof FragmentMessage.WorkerDone) {
                    finishedProducers++;
                } else {
                    accept(message);
                }
            }
            finish();
        } catch (PipelineException exception) {
            errorSlot.trySet(exception);
        } catch (RuntimeException | Error throwable) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.MERGE, null, throwable));
        }
        return outcome();
    }

    /**
     * 合并一条片段或跳过消息。
     *
     * @throws PipelineException 违反合并不变量时抛出
     */
    public void accept(FragmentMessage message) {
        if (message instanceof FragmentMessage.Fragment fragment) {
            mergedIndex.merge(fragment.index());
            documentRecords.add(DocumentRecord.indexed(fragment.document(), fragment.index().wordCount()));
            int merged = mergedIndex.mergedCount();
            if (merged % Constants.PROGRESS_LOG_INTERVAL == 0) {
                logger.info("已合并文档 {} 个", merged);
            }
            long threshold = config.getSpillThresholdPostings();
            if (threshold > 0 && mergedIndex.residentPostingCount() >= threshold) {
                spill();
            }
        } else if (message instanceof FragmentMessage.Skipped skipped) {
            mergedIndex.recordSkip(skipped.skipped().docId());
            skippedDocuments.add(skipped.skipped());
            documentRecords.add(DocumentRecord.skipped(skipped.document(), skipped.skipped().reason()));
        } else {
            throw new IllegalArgumentException("accept 不处理该消息: " + message);
        }
    }

    /**
     * 关闭全部桶，按桶键升序落盘，然后提交清单与文档目录。
     *
     * @throws PipelineException 落盘在重试后仍失败或提交失败时抛出
     */
    public void finish() {
        List<Bucket> buckets = mergedIndex.closeAll();
        logger.info("输入结束，开始落盘 {} 个桶", buckets.size());
        for (Bucket bucket : buckets) {
            if (errorSlot.isSet()) {
                logger.warn("检测到致命错误，停止落盘，已落盘 {}/{} 个桶", flushedBuckets.size(), buckets.size());
                return;
            }
            List<BucketEntry> entries;
            try {
                entries = bucket.sortedEntries();
            } catch (IllegalStateException exception) {
                throw PipelineException.unexpected(PipelineStage.MERGE, null, exception);
            }
            List<Path> runs = runsByKey.remove(bucket.key());
            if (runs != null) {
                entries = mergeRuns(bucket.key(), runs, entries);
            }
            BucketMeta meta = flushWithRetry(bucket.key(), entries);
            flushedBuckets.add(meta);
            bucket.markFlushed(meta.termCount());
        }
        commit();
        if (spillCount > 0) {
            removeSpillDir();
        }
    }

    /**
     * 把每个桶的常驻词条按桶键升序写成溢写段。
     */
    private void spill() {
        Map<String, List<BucketEntry>> resident;
        try {
            resident = mergedIndex.drainResident();
        } catch (IllegalStateException exception) {
            throw PipelineException.unexpected(PipelineStage.MERGE, null, exception);
        }
        spillCount++;
        logger.info("常驻倒排项达到阈值 {}，第 {} 次溢写 {} 个桶",
            config.getSpillThresholdPostings(), spillCount, resident.size());
        for (Map.Entry<String, List<BucketEntry>> entry : resident.entrySet()) {
            String bucketKey = entry.getKey();
            try {
                Path run = spillStore.writeRun(bucketKey, entry.getValue());
                runsByKey.computeIfAbsent(bucketKey, ignored -> new ArrayList<>()).add(run);
            } catch (IOException | RuntimeException exception) {
                throw PipelineException.storage(bucketKey, "写入溢写段失败", exception);
            }
        }
    }

    private List<BucketEntry> mergeRuns(String bucketKey, List<Path> runs, List<BucketEntry> resident) {
        try {
            List<BucketEntry> merged = spillStore.mergeBucket(bucketKey, runs, resident);
            logger.debug("桶 {} 已归并 {} 个溢写段", bucketKey, runs.size());
            return merged;
        } catch (IOException exception) {
            throw PipelineException.storage(bucketKey, "读取溢写段失败", exception);
        } catch (IllegalStateException exception) {
            throw PipelineException.unexpected(PipelineStage.MERGE, null, exception);
        }
    }

    private void removeSpillDir() {
        try {
            spillStore.deleteAll();
        } catch (IOException exception) {
            logger.warn("索引已提交，但清理溢写目录失败，下次运行时会再次清理: {}", spillStore.getSpillDir(), exception);
        }
    }

    private BucketMeta flushWithRetry(String bucketKey, List<BucketEntry> entries) {
        int maxAttempts = config.getFlushMaxAttempts();
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                BucketMeta meta = bucketStore.write(bucketKey, entries);
                logger.debug("桶 {} 已落盘: terms={}, postings={}", bucketKey, meta.termCount(), meta.postingCount());
                return meta;
            } catch (IOException exception) {
                lastFailure = exception;
                logger.warn("桶 {} 第 {}/{} 次落盘失败: {}", bucketKey, attempt, maxAttempts, exception.getMessage());
                if (attempt < maxAttempts) {
                    backOff(bucketKey, exception);
                }
            } catch (RuntimeException exception) {
                throw PipelineException.storage(bucketKey, "写入时出现未预期异常", exception);
            }
        }
        throw PipelineException.storage(bucketKey, "重试 " + maxAttempts + " 次后仍失败", lastFailure);
    }

    private void backOff(String bucketKey, IOException failure) {
        long backoffMillis = config.getFlushRetryBackoffMillis();
        if (backoffMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMillis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            PipelineException exception = PipelineException.storage(bucketKey, "重试等待被中断", failure);
            exception.addSuppressed(interrupted);
            throw exception;
        }
    }

    private void commit() {
        documentRecords.sort(Comparator.comparingInt(DocumentRecord::docId));
        IndexManifest manifest = new IndexManifest(
            Constants.FORMAT_VERSION,
            config.getBucketPrefixLength(),
            documentRecords.size(),
            mergedIndex.mergedCount(),
            mergedIndex.skippedCount(),
            mergedIndex.termCount(),
            flushedBuckets
        );
        try {
            bucketStore.commit(manifest, documentRecords);
        } catch (IOException | RuntimeException exception) {
            throw PipelineException.storage(null, "提交索引清单失败", exception);
        }
        committed = true;
    }

    /**
     * 当前进度快照。
     */
    public MergeOutcome outcome() {
        List<SkippedDocument> skipped = new ArrayList<>(skippedDocuments);
        skipped.sort(Comparator.comparingInt(SkippedDocument::docId));
        return new MergeOutcome(mergedIndex.mergedCount(), skipped, flushedBuckets, mergedIndex.termCount(), committed);
    }
}
