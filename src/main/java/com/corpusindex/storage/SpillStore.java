package com.corpusindex.storage;

import com.corpusindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 合并器溢写段的临时存储。
 *
 * 常驻倒排项超过阈值时，合并器把每个桶当前的有序词条写成一个溢写段（与桶文件同一格式）；
 * 落盘前按桶把溢写段与内存中剩余词条多路归并。同时打开的溢写段数量不超过 maxFanIn，
 * 超出时先把最早的 maxFanIn 个段归并为一个新段，逐层收敛。
 * 实例只属于合并线程。
 */
public final class SpillStore {
    private static final Logger logger = LoggerFactory.getLogger(SpillStore.class);

    private final Path spillDir;
    private final int maxFanIn;
    private int nextRunId;

    public SpillStore(Path spillDir, int maxFanIn) {
        if (spillDir == null) {
            throw new IllegalArgumentException("溢写目录不能为空");
        }
        if (maxFanIn < 2) {
            throw new IllegalArgumentException("maxFanIn 必须 >= 2: " + maxFanIn);
        }
        this.spillDir = spillDir;
        this.maxFanIn = maxFanIn;
    }

    /**
     * 输出目录下默认的溢写存储。
     */
    public static SpillStore forOutputDir(Path outputDir) {
        return new SpillStore(outputDir.resolve(Constants.SPILL_DIR_NAME), Constants.MAX_MERGE_FAN_IN);
    }

    public Path getSpillDir() {
        return spillDir;
    }

    public int getMaxFanIn() {
        return maxFanIn;
    }

    /**
     * 把一个桶的有序词条写成新的溢写段。
     *
     * @return 溢写段路径
     */
    public Path writeRun(String bucketKey, List<BucketEntry> entries) throws IOException {
        Files.createDirectories(spillDir);
        Path target = spillDir.resolve(runFileName(bucketKey));
        Path tempFile = spillDir.resolve(target.getFileName() + Constants.TEMP_FILE_SUFFIX);
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
        return target;
    }

    /**
     * 把一个桶的全部溢写段与内存中剩余词条归并为最终词条，并删除用过的溢写段。
     *
     * @param runs 按写入顺序排列的溢写段
     * @param resident 内存中剩余的有序词条
     * @throws IllegalStateException 同一个词在多个来源中出现相同 docId
     */
    public List<BucketEntry> mergeBucket(String bucketKey, List<Path> runs, List<BucketEntry> resident)
        throws IOException {
        List<Path> pending = new ArrayList<>(runs);
        int residentSlots = resident.isEmpty() ? 0 : 1;
        while (pending.size() + residentSlots > maxFanIn) {
            List<Path> batch = new ArrayList<>(pending.subList(0, maxFanIn));
            Path merged = mergeRuns(bucketKey, batch);
            pending.subList(0, maxFanIn).clear();
            pending.add(merged);
            logger.debug("桶 {} 归并 {} 个溢写段为 {}，剩余 {} 个", bucketKey, batch.size(), merged.getFileName(), pending.size());
        }

        List<EntrySource> sources = new ArrayList<>();
        try {
            for (Path run : pending) {
                sources.add(BucketCursor.open(run));
            }
            if (residentSlots > 0) {
                sources.add(EntrySource.of(resident));
            }
            List<BucketEntry> entries = RunMerger.mergeToList(sources);
            closeAll(sources);
            sources.clear();
            deleteRuns(pending);
            return entries;
        } catch (IOException | RuntimeException exception) {
            closeAll(sources, exception);
            throw exception;
        }
    }

    /**
     * 删除溢写目录及其中全部文件，目录不存在时不做任何事。
     */
    public void deleteAll() throws IOException {
        if (!Files.isDirectory(spillDir)) {
            return;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(spillDir)) {
            for (Path file : stream) {
                files.add(file);
            }
        }
        for (Path file : files) {
            Files.deleteIfExists(file);
        }
        Files.deleteIfExists(spillDir);
        if (!files.isEmpty()) {
            logger.debug("已删除溢写目录 {} 中的 {} 个文件", spillDir, files.size());
        }
    }

    private Path mergeRuns(String bucketKey, List<Path> batch) throws IOException {
        Files.createDirectories(spillDir);
        Path target = spillDir.resolve(runFileName(bucketKey));
        Path tempFile = spillDir.resolve(target.getFileName() + Constants.TEMP_FILE_SUFFIX);
        List<EntrySource> sources = new ArrayList<>();
        BucketWriter writer = null;
        try {
            for (Path run : batch) {
                sources.add(BucketCursor.open(run));
            }
            writer = new BucketWriter(tempFile.toFile());
            try (BucketWriter output = writer) {
                RunMerger.merge(sources, output::writeEntry);
            }
            closeAll(sources);
            sources.clear();
        } catch (IOException | RuntimeException exception) {
            closeAll(sources, exception);
            if (writer != null) {
                StorageFileUtil.deleteQuietly(tempFile, exception);
            }
            throw exception;
        }
        StorageFileUtil.moveAtomically(tempFile, target);
        deleteRuns(batch);
        return target;
    }

    private String runFileName(String bucketKey) {
        int runId = nextRunId++;
        return Constants.RUN_FILE_PREFIX + StorageFileUtil.hexOfUtf8(bucketKey) + "-" + runId
            + Constants.BUCKET_FILE_SUFFIX;
    }

    private static void deleteRuns(List<Path> runs) throws IOException {
        for (Path run : runs) {
            Files.deleteIfExists(run);
        }
    }

    private static void closeAll(List<EntrySource> sources) throws IOException {
        IOException failure = null;
        for (EntrySource source : sources) {
            try {
                source.close();
            } catch (IOException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void closeAll(List<EntrySource> sources, Exception original) {
        for (EntrySource source : sources) {
            try {
                source.close();
            } catch (IOException closeException) {
                original.addSuppressed(closeException);
            }
        }
    }
}
