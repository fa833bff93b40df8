package com.corpusindex.pipeline;

import com.corpusindex.config.IndexerConfig;
import com.corpusindex.document.ContentReader;
import com.corpusindex.document.Document;
import com.corpusindex.document.DocumentSource;
import com.corpusindex.document.FileContentReader;
import com.corpusindex.index.DocumentIndexer;
import com.corpusindex.index.FragmentMessage;
import com.corpusindex.index.MergeOutcome;
import com.corpusindex.index.Merger;
import com.corpusindex.storage.BucketStore;
import com.corpusindex.storage.FileBucketStore;
import com.corpusindex.text.TokenizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * 单线程索引：在调用线程上依次完成读取、分词、合并与落盘，产物与流水线模式一致。
 */
public final class SequentialIndexer {
    private static final Logger logger = LoggerFactory.getLogger(SequentialIndexer.class);

    private final IndexerConfig config;
    private final ContentReader contentReader;
    private final BucketStore bucketStore;

    public SequentialIndexer(IndexerConfig config) {
        this(config, new FileContentReader(), new FileBucketStore(config.getOutputDir()));
    }

    public SequentialIndexer(IndexerConfig config, ContentReader contentReader, BucketStore bucketStore) {
        this.config = config;
        this.contentReader = contentReader;
        this.bucketStore = bucketStore;
    }

    public IndexRunSummary run(DocumentSource source) {
        if (source == null) {
            throw new IllegalArgumentException("文档源不能为空");
        }
        config.validate();
        Instant startedAt = Instant.now();
        logger.info("单线程索引启动: prefixLength={}", config.getBucketPrefixLength());

        FatalErrorSlot errorSlot = new FatalErrorSlot();
        DocumentIndexer documentIndexer = new DocumentIndexer(contentReader, TokenizerFactory.fromConfig(config), config);
        Merger merger = new Merger(bucketStore, config, errorSlot);
        int enumerated = 0;
        try {
            bucketStore.prepare();
        } catch (IOException exception) {
            errorSlot.trySet(PipelineException.storage(null, "准备输出位置失败", exception));
        }
        try {
            while (!errorSlot.isSet()) {
                Optional<Document> next = source.next();
                if (next.isEmpty()) {
                    merger.finish();
                    break;
                }
                enumerated++;
                merger.accept(indexDocument(documentIndexer, next.get()));
            }
        } catch (IOException exception) {
            errorSlot.trySet(PipelineException.enumeration(exception.getMessage(), exception));
        } catch (PipelineException exception) {
            errorSlot.trySet(exception);
        } catch (RuntimeException | Error throwable) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.MERGE, null, throwable));
        }

        MergeOutcome outcome = merger.outcome();
        PipelineException failure = errorSlot.get().orElse(null);
        PipelineState finalState = failure == null ? PipelineState.COMPLETED : PipelineState.FAILED;
        IndexRunSummary summary = IndexRunSummary.of(finalState, enumerated, outcome, failure, startedAt);
        logger.info("单线程索引结束: state={}, indexed={}, skipped={}, buckets={}",
            finalState, summary.documentsIndexed(), summary.skippedCount(), summary.flushedBuckets().size());
        return summary;
    }

    private static FragmentMessage indexDocument(DocumentIndexer documentIndexer, Document document) {
        try {
            return documentIndexer.index(document);
        } catch (PipelineException exception) {
            throw exception;
        } catch (RuntimeException | Error throwable) {
            throw PipelineException.unexpected(PipelineStage.TOKENIZE, document.docId(), throwable);
        }
    }
}
