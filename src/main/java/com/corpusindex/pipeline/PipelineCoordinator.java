package com.corpusindex.pipeline;

import com.corpusindex.config.Constants;
import com.corpusindex.config.IndexerConfig;
import com.corpusindex.document.ContentReader;
import com.corpusindex.document.Document;
import com.corpusindex.document.DocumentSource;
import com.corpusindex.document.FileContentReader;
import com.corpusindex.index.DocumentIndexer;
import com.corpusindex.index.FragmentMessage;
import com.corpusindex.index.MergeOutcome;
import com.corpusindex.index.Merger;
import com.corpusindex.index.TokenizerWorker;
import com.corpusindex.storage.BucketStore;
import com.corpusindex.storage.FileBucketStore;
import com.corpusindex.text.TokenizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 流水线协调器：启动投喂线程、N 个分词线程与合并线程，等待运行结束并汇总结果。
 *
 * 每个实例只能运行一次。
 */
public final class PipelineCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final IndexerConfig config;
    private final ContentReader contentReader;
    private final BucketStore bucketStore;
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);

    public PipelineCoordinator(IndexerConfig config) {
        this(config, new FileContentReader(), new FileBucketStore(config.getOutputDir()));
    }

    public PipelineCoordinator(IndexerConfig config, ContentReader contentReader, BucketStore bucketStore) {
        if (config == null || contentReader == null || bucketStore == null) {
            throw new IllegalArgumentException("config、contentReader 与 bucketStore 均不能为空");
        }
        this.config = config;
        this.contentReader = contentReader;
        this.bucketStore = bucketStore;
    }

    public PipelineState state() {
        return state.get();
    }

    /**
     * 对文档源执行一次完整索引。
     *
     * @param source 文档源
     * @return 运行结果，失败时包含首个致命错误
     * @throws IllegalStateException 实例已经运行过
     * @throws IllegalArgumentException 配置非法
     */
    public IndexRunSummary run(DocumentSource source) {
        if (source == null) {
            throw new IllegalArgumentException("文档源不能为空");
        }
        config.validate();
        if (!state.compareAndSet(PipelineState.IDLE, PipelineState.RUNNING)) {
            throw new IllegalStateException("PipelineCoordinator 只能运行一次，当前状态: " + state.get());
        }
        Instant startedAt = Instant.now();
        int workerCount = Math.min(config.getWorkerThreads(), Constants.MAX_WORKER_THREADS);
        logger.info("流水线启动: workers={}, channelCapacity={}, prefixLength={}",
            workerCount, config.getChannelCapacity(), config.getBucketPrefixLength());

        FatalErrorSlot errorSlot = new FatalErrorSlot(this::beginDraining);
        try {
            bucketStore.prepare();
        } catch (IOException exception) {
            errorSlot.trySet(PipelineException.storage(null, "准备输出位置失败", exception));
            return finish(0, MergeOutcome.empty(), errorSlot, startedAt);
        }

        BoundedChannel<Document> workQueue = new BoundedChannel<>("work", config.getChannelCapacity(), errorSlot);
        BoundedChannel<FragmentMessage> fragmentQueue =
            new BoundedChannel<>("fragment", config.getChannelCapacity(), errorSlot);
        Merger merger = new Merger(bucketStore, config, errorSlot);

        ExecutorService feederExecutor = Executors.newSingleThreadExecutor(new PipelineThreadFactory("source"));
        ExecutorService workerExecutor = Executors.newFixedThreadPool(workerCount, new PipelineThreadFactory("tokenizer"));
        ExecutorService mergerExecutor = Executors.newSingleThreadExecutor(new PipelineThreadFactory("merger"));

        Future<Integer> feederFuture = feederExecutor.submit(
            new SourceFeeder(source, workQueue, workerCount, errorSlot, this::beginDraining));
        List<Future<Integer>> workerFutures = new ArrayList<>(workerCount);
        for (int workerId = 0; workerId < workerCount; workerId++) {
            DocumentIndexer documentIndexer =
                new DocumentIndexer(contentReader, TokenizerFactory.fromConfig(config), config);
            workerFutures.add(workerExecutor.submit(
                new TokenizerWorker(workerId, documentIndexer, workQueue, fragmentQueue, errorSlot)));
        }
        Future<MergeOutcome> mergerFuture = mergerExecutor.submit(() -> merger.drain(fragmentQueue, workerCount));

        MergeOutcome outcome = awaitMerger(mergerFuture, errorSlot);
        shutdown(feederExecutor);
        shutdown(workerExecutor);
        shutdown(mergerExecutor);

        int enumerated = awaitCount(feederFuture, PipelineStage.SOURCE, errorSlot);
        int processed = 0;
        for (Future<Integer> workerFuture : workerFutures) {
            processed += awaitCount(workerFuture, PipelineStage.TOKENIZE, errorSlot);
        }
        logger.debug("分词线程共处理 {} 个文档", processed);

        if (!errorSlot.isSet() && enumerated != outcome.indexedCount() + outcome.skipped().size()) {
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR,
                "文档计数不一致: enumerated=" + enumerated + ", indexed=" + outcome.indexedCount()
                    + ", skipped=" + outcome.skipped().size(), null));
        }
        return finish(enumerated, outcome, errorSlot, startedAt);
    }

    private MergeOutcome awaitMerger(Future<MergeOutcome> mergerFuture, FatalErrorSlot errorSlot) {
        long deadlineMillis = config.getDeadlineMillis();
        try {
            if (deadlineMillis > 0) {
                try {
                    return mergerFuture.get(deadlineMillis, TimeUnit.MILLISECONDS);
                } catch (TimeoutException timeout) {
                    errorSlot.trySet(PipelineException.deadlineExceeded(deadlineMillis));
                }
            }
            return mergerFuture.get();
        } catch (InterruptedException interrupted) {
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR, "等待合并线程时被中断", interrupted));
            MergeOutcome outcome = awaitCancelledMerger(mergerFuture, errorSlot);
            Thread.currentThread().interrupt();
            return outcome;
        } catch (ExecutionException exception) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.MERGE, null, exception.getCause()));
        }
        return MergeOutcome.empty();
    }

    /**
     * 错误槽已置位后，合并线程会在下一次通道轮询时退出；在宽限时间内取回它的真实进度。
     */
    private MergeOutcome awaitCancelledMerger(Future<MergeOutcome> mergerFuture, FatalErrorSlot errorSlot) {
        try {
            return mergerFuture.get(Constants.SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            logger.warn("等待合并线程退出时再次被中断，合并进度未知", interrupted);
        } catch (TimeoutException timeout) {
            logger.warn("合并线程未在 {}ms 内退出，合并进度未知", Constants.SHUTDOWN_GRACE_MILLIS);
        } catch (ExecutionException exception) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.MERGE, null, exception.getCause()));
        }
        return MergeOutcome.empty();
    }

    private int awaitCount(Future<Integer> future, PipelineStage stage, FatalErrorSlot errorSlot) {
        if (!future.isDone()) {
            logger.warn("{} 线程未在宽限时间内结束，其处理计数未计入结果", stage);
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR,
                stage + " 线程未在宽限时间内结束", null));
            return 0;
        }
        try {
            return future.get();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR, "等待 " + stage + " 线程时被中断", interrupted));
        } catch (ExecutionException exception) {
            errorSlot.trySet(PipelineException.unexpected(stage, null, exception.getCause()));
        }
        return 0;
    }

    /**
     * 等待线程在宽限时间内退出，超时后中断。
     */
    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Constants.SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                logger.warn("流水线线程未在 {}ms 内退出，强制中断", Constants.SHUTDOWN_GRACE_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void beginDraining() {
        if (state.compareAndSet(PipelineState.RUNNING, PipelineState.DRAINING)) {
            logger.info("流水线状态: RUNNING -> DRAINING");
        }
    }

    private IndexRunSummary finish(int enumerated, MergeOutcome outcome, FatalErrorSlot errorSlot, Instant startedAt) {
        beginDraining();
        PipelineException failure = errorSlot.get().orElse(null);
        PipelineState finalState = failure == null ? PipelineState.COMPLETED : PipelineState.FAILED;
        state.set(finalState);
        IndexRunSummary summary = IndexRunSummary.of(finalState, enumerated, outcome, failure, startedAt);
        if (failure == null) {
            logger.info("流水线状态: DRAINING -> COMPLETED, indexed={}, skipped={}, buckets={}, elapsed={}ms",
                summary.documentsIndexed(), summary.skippedCount(), summary.flushedBuckets().size(),
                summary.elapsed().toMillis());
        } else {
            logger.error("流水线状态: DRAINING -> FAILED, stage={}, merged={}, bucketsFlushed={}",
                failure.getStage(), summary.documentsIndexed(), summary.flushedBuckets().size());
        }
        return summary;
    }
}
