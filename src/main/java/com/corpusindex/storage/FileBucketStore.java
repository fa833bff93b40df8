package com.corpusindex.storage;

import com.corpusindex.config.Constants;
import com.corpusindex.document.DocumentRecord;
import com.corpusindex.document.DocumentTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于本地目录的桶存储：每个桶一个 bucket-&lt;前缀十六进制&gt;.bkt 文件，
 * 先写临时文件再原子改名；索引清单最后写入，作为一次运行成功的标记。
 */
public final class FileBucketStore implements BucketStore {
    private static final Logger logger = LoggerFactory.getLogger(FileBucketStore.class);

    private final Path outputDir;

    public FileBucketStore(Path outputDir) {
        if (outputDir == null) {
            throw new IllegalArgumentException("输出目录不能为空");
        }
        this.outputDir = outputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    @Override
    public void prepare() throws IOException {
        Files.createDirectories(outputDir);
        List<Path> staleFiles = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir)) {
            for (Path file : stream) {
                if (isIndexArtifact(file.getFileName().toString())) {
                    staleFiles.add(file);
                }
            }
        }
        for (Path staleFile : staleFiles) {
            Files.deleteIfExists(staleFile);
        }
        if (!staleFiles.isEmpty()) {
            logger.info("已清理上次运行遗留的 {} 个索引文件: {}", staleFiles.size(), outputDir);
        }
        SpillStore.forOutputDir(outputDir).deleteAll();
    }

    @Override
    public BucketMeta write(String bucketKey, List<BucketEntry> entries) throws IOException {
        if (bucketKey == null || bucketKey.isEmpty()) {
            throw new IllegalArgumentException("桶键不能为空");
        }
        String fileName = bucketFileName(bucketKey);
        Path target = outputDir.resolve(fileName);
        Path tempFile = outputDir.resolve(fileName + Constants.TEMP_FILE_SUFFIX);

        BucketWriter writer = new BucketWriter(tempFile.toFile());
        try {
            try (writer) {
                for (BucketEntry entry : entries) {
                    writer.writeEntry(entry);
                }
            }
        } catch (IOException | RuntimeException exception) {
            StorageFileUtil.deleteQuietly(tempFile, exception);
            throw exception;
        }
        StorageFileUtil.moveAtomically(tempFile, target);

        BucketMeta meta = new BucketMeta(bucketKey, fileName, writer.getTermCount(), writer.getPostingCount(),
            Files.size(target), writer.getCrc32());
        logger.debug("桶已落盘: key={}, file={}, terms={}, postings={}",
            bucketKey, fileName, meta.termCount(), meta.postingCount());
        return meta;
    }

    @Override
    public void commit(IndexManifest manifest, List<DocumentRecord> documents) throws IOException {
        Path catalogFile = outputDir.resolve(Constants.CATALOG_FILE_NAME);
        try (DocumentTable documentTable = new DocumentTable(catalogFile)) {
            documentTable.insertAll(documents);
        } catch (IllegalStateException exception) {
            throw new IOException("写入文档目录失败: " + catalogFile, exception);
        }

        Path manifestFile = outputDir.resolve(Constants.MANIFEST_FILE_NAME);
        Path tempFile = outputDir.resolve(Constants.MANIFEST_FILE_NAME + Constants.TEMP_FILE_SUFFIX);
        try {
            manifest.writeTo(tempFile.toFile());
        } catch (IOException exception) {
            StorageFileUtil.deleteQuietly(tempFile, exception);
            throw exception;
        }
        StorageFileUtil.moveAtomically(tempFile, manifestFile);
        logger.info("索引已提交: dir={}, buckets={}, documents={}",
            outputDir, manifest.buckets().size(), manifest.documentCount());
    }

    /**
     * 读取输出目录中的索引清单。
     */
    public IndexManifest readManifest() throws IOException {
        Path manifestFile = outputDir.resolve(Constants.MANIFEST_FILE_NAME);
        if (!Files.isRegularFile(manifestFile)) {
            throw new IOException("索引清单不存在: " + manifestFile);
        }
        return IndexManifest.readFrom(manifestFile.toFile());
    }

    /**
     * 列出输出目录中全部桶文件名，按名称排序。
     */
    public List<String> listBucketFiles() throws IOException {
        List<String> fileNames = new ArrayList<>();
        if (!Files.isDirectory(outputDir)) {
            return fileNames;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir,
            Constants.BUCKET_FILE_PREFIX + "*" + Constants.BUCKET_FILE_SUFFIX)) {
            for (Path file : stream) {
                fileNames.add(file.getFileName().toString());
            }
        }
        fileNames.sort(String::compareTo);
        return fileNames;
    }

    /**
     * 桶文件名：桶键 UTF-8 字节的小写十六进制，保证任意前缀都能安全落到文件系统。
     */
    public static String bucketFileName(String bucketKey) {
        return Constants.BUCKET_FILE_PREFIX + StorageFileUtil.hexOfUtf8(bucketKey) + Constants.BUCKET_FILE_SUFFIX;
    }

    private static boolean isIndexArtifact(String fileName) {
        if (fileName.startsWith(Constants.BUCKET_FILE_PREFIX)
            && (fileName.endsWith(Constants.BUCKET_FILE_SUFFIX) || fileName.endsWith(Constants.TEMP_FILE_SUFFIX))) {
            return true;
        }
        return fileName.equals(Constants.MANIFEST_FILE_NAME)
            || fileName.equals(Constants.MANIFEST_FILE_NAME + Constants.TEMP_FILE_SUFFIX)
            || fileName.startsWith(Constants.CATALOG_FILE_NAME);
    }
}
