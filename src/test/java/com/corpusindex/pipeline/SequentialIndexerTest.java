package com.corpusindex.pipeline;

import com.corpusindex.config.IndexerConfig;
import com.corpusindex.storage.FileBucketStore;
import com.corpusindex.storage.IndexManifest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequentialIndexerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("单线程索引成功并提交清单")
    void testSequentialRun() throws IOException {
        Path outputDir = tempDir.resolve("index");
        InMemoryCorpus corpus = InMemoryCorpus.of("alpha beta", "beta gamma", "gamma")
            .failOn(3, new AccessDeniedException("mem/doc-3.txt"));

        IndexRunSummary summary = indexer(outputDir, corpus).run(corpus.source());

        assertTrue(summary.succeeded());
        assertEquals(3, summary.documentsEnumerated());
        assertEquals(2, summary.documentsIndexed());
        assertEquals(1, summary.skippedCount());
        assertEquals(3, summary.termCount());
        IndexManifest manifest = new FileBucketStore(outputDir).readManifest();
        assertEquals(3, manifest.documentCount());
        assertEquals(3, manifest.buckets().size());
    }

    @Test
    @DisplayName("输出位置不可用时归为 STORAGE 阶段")
    void testPrepareFailure() throws IOException {
        Path blocked = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        InMemoryCorpus corpus = InMemoryCorpus.of("alpha");

        IndexRunSummary summary = indexer(blocked, corpus).run(corpus.source());

        assertFalse(summary.succeeded());
        assertEquals(PipelineStage.STORAGE, summary.failure().stage());
        assertEquals(0, summary.documentsEnumerated());
    }

    @Test
    @DisplayName("桶写入失败时报告桶键")
    void testStorageFailure() {
        Path outputDir = tempDir.resolve("index");
        IndexerConfig config = PipelineCoordinatorTest.config(outputDir, 1);
        config.setFlushRetryBackoffMillis(0);
        InMemoryCorpus corpus = InMemoryCorpus.of("apple banana cherry");

        IndexRunSummary summary = new SequentialIndexer(config, corpus, new FailingBucketStore(outputDir, "b"))
            .run(corpus.source());

        assertEquals(PipelineState.FAILED, summary.state());
        assertEquals("b", summary.failure().bucketKey());
        assertEquals(1, summary.flushedBuckets().size());
    }

    @Test
    @DisplayName("读取器抛出未预期异常时归为 TOKENIZE 阶段")
    void testUnexpectedReaderFailure() {
        Path outputDir = tempDir.resolve("index");
        InMemoryCorpus corpus = InMemoryCorpus.of("one", "two", "three")
            .crashOn(2, new UncheckedIOException(new IOException("读取器内部错误")));

        IndexRunSummary summary = indexer(outputDir, corpus).run(corpus.source());

        assertEquals(PipelineState.FAILED, summary.state());
        assertEquals(PipelineStage.TOKENIZE, summary.failure().stage());
        assertEquals(2, summary.failure().docId());
        assertEquals(1, summary.documentsIndexed());
    }

    private static SequentialIndexer indexer(Path outputDir, InMemoryCorpus corpus) {
        return new SequentialIndexer(PipelineCoordinatorTest.config(outputDir, 1), corpus, new FileBucketStore(outputDir));
    }
}
