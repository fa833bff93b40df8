package com.corpusindex;

import com.corpusindex.config.IndexerConfig;
import com.corpusindex.document.EnumeratingDocumentSource;
import com.corpusindex.document.FileTreeWalker;
import com.corpusindex.pipeline.IndexRunSummary;
import com.corpusindex.pipeline.PipelineCoordinator;
import com.corpusindex.pipeline.SequentialIndexer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引吞吐基准测试：流水线模式与单线程模式对比
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @Param({"1", "4"})
    int workerThreads;

    Path tempDir;
    Path sourceDir;

    @Setup
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("benchmark");
        sourceDir = tempDir.resolve("source");
        Files.createDirectories(sourceDir);

        // 创建1000个测试文件
        for (int i = 0; i < 1000; i++) {
            Files.writeString(sourceDir.resolve("doc" + i + ".txt"), generateDocument(i));
        }
    }

    @TearDown
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        }
    }

    @Benchmark
    public IndexRunSummary pipelineThroughput() {
        return new PipelineCoordinator(config("pipeline")).run(source());
    }

    @Benchmark
    public IndexRunSummary sequentialThroughput() {
        return new SequentialIndexer(config("sequential")).run(source());
    }

    private IndexerConfig config(String name) {
        IndexerConfig config = IndexerConfig.defaults();
        config.setWorkerThreads(workerThreads);
        config.setOutputDir(tempDir.resolve("index-" + name));
        return config;
    }

    private EnumeratingDocumentSource source() {
        return new EnumeratingDocumentSource(new FileTreeWalker(List.of(sourceDir), List.of()));
    }

    private static String generateDocument(int index) {
        return "Document " + index + " content. "
            + "This is a test document for benchmarking. "
            + "It contains various words like Java, Python, programming, "
            + "search, index, document, file, content, data, "
            + "performance, benchmark, test, example. "
            + "The quick brown fox jumps over the lazy dog. "
            + " repeated text to increase size.".repeat(5);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
