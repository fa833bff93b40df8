package com.corpusindex.cli;

import com.corpusindex.config.Constants;
import com.corpusindex.config.IndexerConfig;
import com.corpusindex.config.TokenizerMode;
import com.corpusindex.document.DocumentRecord;
import com.corpusindex.document.DocumentStatus;
import com.corpusindex.document.DocumentTable;
import com.corpusindex.document.EnumeratingDocumentSource;
import com.corpusindex.document.FileTreeWalker;
import com.corpusindex.index.IndexVerifier;
import com.corpusindex.index.SkippedDocument;
import com.corpusindex.pipeline.IndexRunSummary;
import com.corpusindex.pipeline.PipelineCoordinator;
import com.corpusindex.pipeline.SequentialIndexer;
import com.corpusindex.storage.BucketMeta;
import com.corpusindex.storage.FileBucketStore;
import com.corpusindex.storage.IndexManifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "cix",
    description = "📚 并行语料倒排索引构建工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.VerifySubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 并行语料倒排索引构建工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    static int resolveThreadCount(int threads) {
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, Constants.DEFAULT_WORKER_THREADS);
            return Constants.DEFAULT_WORKER_THREADS;
        }
        if (threads > Constants.MAX_WORKER_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_WORKER_THREADS);
            return Constants.MAX_WORKER_THREADS;
        }
        return threads;
    }

    static ObjectMapper jsonMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Command(name = "index", description = "📂 对文件或目录构建倒排索引")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的文件或目录（目录递归展开）", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"-o", "--output-dir"}, description = "索引输出目录，默认 ./index")
        private Path outputDir;

        @Option(names = {"-t", "--threads"}, description = "分词线程数")
        private Integer threads;

        @Option(names = {"--channel-capacity"}, description = "通道容量")
        private Integer channelCapacity;

        @Option(names = {"--prefix-length"}, description = "分桶前缀长度（码点数）")
        private Integer prefixLength;

        @Option(names = {"--spill-threshold"}, description = "常驻倒排项达到该数量时溢写临时文件，0 表示不溢写")
        private Long spillThreshold;

        @Option(names = {"--cjk-bigrams"}, description = "CJK 连续片段按重叠双字切分（默认整体成词）")
        private boolean cjkBigrams;

        @Option(names = {"-c", "--config"}, description = "JSON 配置文件，命令行参数优先")
        private Path configFile;

        @Option(names = {"-1", "--single-threaded"}, description = "在当前线程内完成全部工作")
        private boolean singleThreaded;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            IndexerConfig config;
            try {
                config = buildConfig();
            } catch (IOException | IllegalArgumentException exception) {
                System.err.println("❌ 配置无效: " + exception.getMessage());
                return 1;
            }

            boolean json = "json".equalsIgnoreCase(format);
            if (!json) {
                System.out.println("🚀 开始索引...");
                System.out.println("📁 输出目录: " + config.getOutputDir());
                System.out.println("📂 源路径: " + sourcePaths);
                System.out.println(singleThreaded ? "🔧 单线程模式" : "🔧 分词线程数: " + config.getWorkerThreads());
            }

            EnumeratingDocumentSource source = new EnumeratingDocumentSource(
                new FileTreeWalker(sourcePaths, config.getIncludeExtensions()));
            IndexRunSummary summary = singleThreaded
                ? new SequentialIndexer(config).run(source)
                : new PipelineCoordinator(config).run(source);

            try {
                if (json) {
                    System.out.println(jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(summary));
                } else {
                    printTextSummary(summary);
                }
            } catch (IOException exception) {
                System.err.println("❌ 输出结果失败: " + exception.getMessage());
                return 1;
            }
            return summary.succeeded() ? 0 : 1;
        }

        IndexerConfig buildConfig() throws IOException {
            IndexerConfig config = configFile == null ? IndexerConfig.defaults() : IndexerConfig.load(configFile);
            if (outputDir != null) {
                config.setOutputDir(outputDir);
            }
            if (threads != null) {
                config.setWorkerThreads(resolveThreadCount(threads));
            }
            if (channelCapacity != null) {
                config.setChannelCapacity(channelCapacity);
            }
            if (prefixLength != null) {
                config.setBucketPrefixLength(prefixLength);
            }
            if (spillThreshold != null) {
                config.setSpillThresholdPostings(spillThreshold);
            }
            if (cjkBigrams) {
                config.setTokenizerMode(TokenizerMode.COMPOSITE);
            }
            return config.validate();
        }

        private void printTextSummary(IndexRunSummary summary) {
            if (summary.succeeded()) {
                System.out.println("✅ 索引完成！");
            } else {
                IndexRunSummary.FailureInfo failure = summary.failure();
                System.err.println("❌ 索引失败 [" + failure.stage() + "]: " + failure.message());
                if (failure.docId() != null) {
                    System.err.println("   文档: " + failure.docId());
                }
                if (failure.bucketKey() != null) {
                    System.err.println("   桶: " + failure.bucketKey());
                }
            }
            System.out.println("📊 统计:");
            System.out.println("   枚举文档: " + summary.documentsEnumerated());
            System.out.println("   已索引: " + summary.documentsIndexed());
            System.out.println("   已跳过: " + summary.skippedCount());
            System.out.println("   词条数: " + summary.termCount());
            System.out.println("   已落盘桶: " + summary.flushedBuckets().size());
            System.out.println("   用时: " + summary.elapsed().toMillis() + "ms");
            for (SkippedDocument skipped : summary.skipped()) {
                System.out.printf("   ⚠️ 跳过 #%d %s (%s): %s%n",
                    skipped.docId(), skipped.path(), skipped.errorKind(), skipped.reason());
            }
        }
    }

    @Command(name = "verify", description = "🔍 校验索引输出目录")
    static class VerifySubcommand implements Callable<Integer> {

        @Option(names = {"-o", "--output-dir"}, description = "索引输出目录", defaultValue = "./index")
        private Path outputDir;

        @Override
        public Integer call() {
            try {
                IndexVerifier.VerificationReport report = new IndexVerifier(new FileBucketStore(outputDir)).verify();
                if (!report.passed()) {
                    System.err.println("❌ 校验失败:");
                    for (String problem : report.problems()) {
                        System.err.println("   " + problem);
                    }
                    return 1;
                }
                System.out.println("✅ 校验通过");
                System.out.println("   桶数: " + report.bucketCount());
                System.out.println("   词条数: " + report.termCount());
                System.out.println("   倒排项: " + report.postingCount());
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 校验失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引清单与文档目录")
    static class StatusSubcommand implements Callable<Integer> {

        @Option(names = {"-o", "--output-dir"}, description = "索引输出目录", defaultValue = "./index")
        private Path outputDir;

        @Override
        public Integer call() {
            try {
                IndexManifest manifest = new FileBucketStore(outputDir).readManifest();
                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 输出目录: " + outputDir);
                System.out.println("📄 文档总数: " + manifest.documentCount());
                System.out.println("✅ 已索引: " + manifest.indexedCount());
                System.out.println("⚠️ 已跳过: " + manifest.skippedCount());
                System.out.println("🔤 词条总数: " + manifest.termCount());
                System.out.println("📦 桶数量: " + manifest.buckets().size());
                long totalBytes = 0;
                for (BucketMeta bucket : manifest.buckets()) {
                    totalBytes += bucket.sizeBytes();
                }
                System.out.println("💾 索引大小: " + formatBytes(totalBytes));

                Path catalogFile = outputDir.resolve(Constants.CATALOG_FILE_NAME);
                if (Files.isRegularFile(catalogFile)) {
                    try (DocumentTable documentTable = new DocumentTable(catalogFile)) {
                        System.out.println("🗂️ 文档目录条目: " + documentTable.getTotalDocCount());
                        for (DocumentRecord record : documentTable.findByStatus(DocumentStatus.SKIPPED)) {
                            System.out.printf("   ⚠️ #%d %s: %s%n", record.docId(), record.path(), record.reason());
                        }
                    }
                }
                return 0;
            } catch (IOException | IllegalStateException exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        static String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
