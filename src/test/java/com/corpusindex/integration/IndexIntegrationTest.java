package com.corpusindex.integration;

import com.corpusindex.config.Constants;
import com.corpusindex.config.ErrorKind;
import com.corpusindex.config.IndexerConfig;
import com.corpusindex.config.TokenizerMode;
import com.corpusindex.document.DocumentRecord;
import com.corpusindex.document.DocumentStatus;
import com.corpusindex.document.DocumentTable;
import com.corpusindex.document.EnumeratingDocumentSource;
import com.corpusindex.document.FileTreeWalker;
import com.corpusindex.index.IndexVerifier;
import com.corpusindex.pipeline.IndexRunSummary;
import com.corpusindex.pipeline.PipelineCoordinator;
import com.corpusindex.pipeline.PipelineStage;
import com.corpusindex.storage.BucketEntry;
import com.corpusindex.storage.BucketReader;
import com.corpusindex.storage.FileBucketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引集成测试
 *
 * 覆盖完整流程：目录遍历 → 流水线索引 → 桶文件校验 → 文档目录 → 重建
 */
class IndexIntegrationTest {

    @TempDir
    Path tempDir;

    private Path indexDir;
    private Path sourceDir;
    private IndexerConfig config;

    @BeforeEach
    void setUp() throws IOException {
        indexDir = tempDir.resolve("index");
        sourceDir = tempDir.resolve("source");
        Files.createDirectories(sourceDir.resolve("nested"));

        Files.writeString(sourceDir.resolve("a.txt"), "Java pipeline builds an inverted index");
        Files.writeString(sourceDir.resolve("nested").resolve("b.txt"), "倒排索引 pipeline 测试");
        Files.write(sourceDir.resolve("nested").resolve("c.txt"), new byte[]{'b', 'a', 'd', (byte) 0xFF, (byte) 0xFE});
        Files.writeString(sourceDir.resolve("z.md"), "index index index");

        config = IndexerConfig.defaults();
        config.setOutputDir(indexDir);
        config.setWorkerThreads(3);
    }

    @Test
    void testEndToEndIndexing() throws IOException {
        IndexRunSummary summary = runIndex(config);

        assertTrue(summary.succeeded(), () -> String.valueOf(summary.failure()));
        assertEquals(4, summary.documentsEnumerated());
        assertEquals(3, summary.documentsIndexed());
        assertEquals(1, summary.skippedCount());
        assertEquals(3, summary.skipped().get(0).docId());
        assertEquals(ErrorKind.DECODE_ERROR, summary.skipped().get(0).errorKind());

        IndexVerifier.VerificationReport report = new IndexVerifier(new FileBucketStore(indexDir)).verify();
        assertTrue(report.passed(), () -> String.join("\n", report.problems()));
        assertEquals(summary.termCount(), report.termCount());

        BucketEntry pipeline = readEntry("p", "pipeline");
        assertEquals(List.of(1, 2), pipeline.docIds());
        BucketEntry index = readEntry("i", "index");
        assertEquals(List.of(1, 4), index.docIds());
        assertEquals(3, index.postings().get(1).termFreq());
        assertEquals(List.of(2), readEntry("倒", "倒排索引").docIds());
        assertEquals(List.of(2), readEntry("测", "测试").docIds());
        assertFalse(Files.exists(indexDir.resolve(FileBucketStore.bucketFileName("索"))));
    }

    @Test
    void testCjkBigramModeIsOptIn() throws IOException {
        config.setTokenizerMode(TokenizerMode.COMPOSITE);

        assertTrue(runIndex(config).succeeded());

        assertEquals(List.of(2), readEntry("倒", "倒排").docIds());
        assertEquals(List.of(2), readEntry("索", "索引").docIds());
        assertEquals(List.of(2), readEntry("排", "排索").docIds());
        assertTrue(new IndexVerifier(new FileBucketStore(indexDir)).verify().passed());
    }

    @Test
    void testDocumentCatalogWritten() {
        assertTrue(runIndex(config).succeeded());

        try (DocumentTable documentTable = new DocumentTable(indexDir.resolve(Constants.CATALOG_FILE_NAME))) {
            assertEquals(4, documentTable.getTotalDocCount());
            DocumentRecord first = documentTable.findById(1).orElseThrow();
            assertEquals(sourceDir.resolve("a.txt").toAbsolutePath().normalize(), first.path());
            assertEquals(DocumentStatus.INDEXED, first.status());
            assertEquals(6, first.tokenCount());

            List<DocumentRecord> skipped = documentTable.findByStatus(DocumentStatus.SKIPPED);
            assertEquals(1, skipped.size());
            assertEquals(3, skipped.get(0).docId());
            assertNotNull(skipped.get(0).reason());
        }
    }

    @Test
    void testRebuildReplacesPreviousOutput() throws IOException {
        assertTrue(runIndex(config).succeeded());
        byte[] firstManifest = Files.readAllBytes(indexDir.resolve(Constants.MANIFEST_FILE_NAME));
        Files.writeString(indexDir.resolve(FileBucketStore.bucketFileName("stale")), "leftover");

        assertTrue(runIndex(config).succeeded());

        assertArrayEquals(firstManifest, Files.readAllBytes(indexDir.resolve(Constants.MANIFEST_FILE_NAME)));
        assertTrue(new IndexVerifier(new FileBucketStore(indexDir)).verify().passed());
    }

    @Test
    void testExtensionFilter() {
        config.setIncludeExtensions(List.of(".md"));

        IndexRunSummary summary = runIndex(config);

        assertTrue(summary.succeeded());
        assertEquals(1, summary.documentsEnumerated());
        assertEquals(1, summary.termCount());
    }

    @Test
    void testMissingRootFailsAtSource() {
        IndexRunSummary summary = new PipelineCoordinator(config).run(new EnumeratingDocumentSource(
            new FileTreeWalker(List.of(tempDir.resolve("does-not-exist")), List.of())));

        assertFalse(summary.succeeded());
        assertEquals(PipelineStage.SOURCE, summary.failure().stage());
        assertFalse(Files.exists(indexDir.resolve(Constants.MANIFEST_FILE_NAME)));
    }

    private IndexRunSummary runIndex(IndexerConfig indexerConfig) {
        EnumeratingDocumentSource source = new EnumeratingDocumentSource(
            new FileTreeWalker(List.of(sourceDir), indexerConfig.getIncludeExtensions()));
        return new PipelineCoordinator(indexerConfig).run(source);
    }

    private BucketEntry readEntry(String bucketKey, String word) throws IOException {
        BucketReader reader = new BucketReader(indexDir.resolve(FileBucketStore.bucketFileName(bucketKey)).toFile());
        return reader.lookup(word).orElseThrow();
    }
}
