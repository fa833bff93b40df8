package com.corpusindex.storage;

import com.corpusindex.config.Constants;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 桶文件格式集成测试，覆盖写入读取一致性、顺序约束与 CRC 防护。
 */
class StorageRoundTripTest {

    @TempDir
    Path tempDir;

    /**
     * 验证桶文件写入读取一致性与精确查找能力。
     */
    @Test
    void bucketRoundTripAndLookup() throws IOException {
        File bucketFile = tempDir.resolve("bucket-61.bkt").toFile();
        List<BucketEntry> expected = buildEntries();

        long postingCount = 0;
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            for (BucketEntry entry : expected) {
                writer.writeEntry(entry);
                postingCount += entry.docFreq();
            }
            assertEquals(expected.size(), writer.getTermCount());
        }

        BucketReader reader = new BucketReader(bucketFile);
        assertEquals(expected.size(), reader.getTermCount());
        assertEquals(postingCount, reader.getPostingCount());
        assertEquals(expected, reader.entries());

        BucketEntry apple = reader.lookup("apple").orElseThrow();
        assertEquals(List.of(1, 4, 900), apple.docIds());
        assertArrayEquals(new int[]{0, 7, 300}, apple.postings().get(2).positions());
        assertFalse(reader.lookup("missing").isPresent());
    }

    /**
     * 空桶也是合法文件。
     */
    @Test
    void emptyBucketRoundTrip() throws IOException {
        File bucketFile = tempDir.resolve("empty.bkt").toFile();
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            assertEquals(0, writer.getTermCount());
        }

        BucketReader reader = new BucketReader(bucketFile);
        assertEquals(0, reader.getTermCount());
        assertTrue(reader.words().isEmpty());
    }

    /**
     * 非 ASCII 词按 UTF-8 编码写入。
     */
    @Test
    void unicodeWordsRoundTrip() throws IOException {
        File bucketFile = tempDir.resolve("unicode.bkt").toFile();
        List<BucketEntry> entries = List.of(
            new BucketEntry("café", List.of(new Posting(2, new int[]{1}))),
            new BucketEntry("搜索", List.of(new Posting(1, new int[]{0, 4}), new Posting(3, new int[]{2})))
        );
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            for (BucketEntry entry : entries) {
                writer.writeEntry(entry);
            }
        }

        assertEquals(List.of("café", "搜索"), new BucketReader(bucketFile).words());
    }

    /**
     * 写入器拒绝乱序的词与 docId。
     */
    @Test
    void writerRejectsOutOfOrderInput() throws IOException {
        File bucketFile = tempDir.resolve("order.bkt").toFile();
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            writer.writeEntry(new BucketEntry("beta", List.of(new Posting(1, new int[]{0}))));
            assertThrows(IllegalArgumentException.class,
                () -> writer.writeEntry(new BucketEntry("alpha", List.of(new Posting(1, new int[]{0})))));
            assertThrows(IllegalArgumentException.class,
                () -> writer.writeEntry(new BucketEntry("beta", List.of(new Posting(2, new int[]{0})))));
            assertThrows(IllegalArgumentException.class,
                () -> writer.writeEntry(new BucketEntry("gamma",
                    List.of(new Posting(5, new int[]{0}), new Posting(3, new int[]{0})))));
        }
        assertEquals(List.of("beta"), new BucketReader(bucketFile).words());
    }

    /**
     * 关闭后继续写入应抛出 IllegalStateException。
     */
    @Test
    void writeAfterCloseShouldThrow() throws IOException {
        BucketWriter writer = new BucketWriter(tempDir.resolve("closed.bkt").toFile());
        writer.close();
        assertThrows(IllegalStateException.class,
            () -> writer.writeEntry(new BucketEntry("late", List.of(new Posting(1, new int[]{0})))));
    }

    /**
     * 验证 CRC32 校验可拦截损坏文件。
     */
    @Test
    void crcCorruptionShouldThrow() throws IOException {
        File bucketFile = tempDir.resolve("crc.bkt").toFile();
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            writer.writeEntry(new BucketEntry("checksum", List.of(new Posting(3, new int[]{1, 2}))));
        }
        corruptOneByte(bucketFile, 12);
        IOException exception = assertThrows(IOException.class, () -> new BucketReader(bucketFile));
        assertTrue(exception.getMessage().contains("CRC32"));
    }

    /**
     * CRC 正确但 magic 不符的文件同样被拒绝。
     */
    @Test
    void wrongMagicShouldThrow() throws IOException {
        File bucketFile = tempDir.resolve("magic.bkt").toFile();
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(bucketFile, "rw")) {
            randomAccessFile.writeInt(0x12345678);
            randomAccessFile.writeShort(Constants.FORMAT_VERSION);
            randomAccessFile.writeInt(0);
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        }
        IOException exception = assertThrows(IOException.class, () -> new BucketReader(bucketFile));
        assertTrue(exception.getMessage().contains("magic"));
    }

    /**
     * 过短的文件被拒绝。
     */
    @Test
    void truncatedFileShouldThrow() throws IOException {
        File bucketFile = tempDir.resolve("short.bkt").toFile();
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(bucketFile, "rw")) {
            randomAccessFile.writeShort(1);
        }
        assertThrows(IOException.class, () -> new BucketReader(bucketFile));
    }

    /**
     * 构造有序的测试词条，docId 与位置严格递增。
     */
    private List<BucketEntry> buildEntries() {
        List<String> words = new ArrayList<>(List.of("app", "apple", "application", "apply"));
        for (int index = 0; index < 40; index++) {
            words.add("term_" + String.format("%03d", index));
        }
        words.sort(String::compareTo);

        Random random = new Random(7);
        List<BucketEntry> entries = new ArrayList<>();
        for (String word : words) {
            List<Posting> postings = new ArrayList<>();
            if (word.equals("apple")) {
                postings.add(new Posting(1, new int[]{3}));
                postings.add(new Posting(4, new int[]{1, 2}));
                postings.add(new Posting(900, new int[]{0, 7, 300}));
            } else {
                int docId = 0;
                int postingCount = random.nextInt(20) + 1;
                for (int index = 0; index < postingCount; index++) {
                    docId += random.nextInt(1000) + 1;
                    int position = random.nextInt(50);
                    int[] positions = new int[random.nextInt(4) + 1];
                    for (int positionIndex = 0; positionIndex < positions.length; positionIndex++) {
                        positions[positionIndex] = position;
                        position += random.nextInt(200) + 1;
                    }
                    postings.add(new Posting(docId, positions));
                }
            }
            entries.add(new BucketEntry(word, postings));
        }
        return entries;
    }

    /**
     * 定位到指定偏移并翻转一个字节，模拟磁盘损坏。
     */
    private void corruptOneByte(File file, long offset) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "rw")) {
            randomAccessFile.seek(offset);
            int original = randomAccessFile.read();
            randomAccessFile.seek(offset);
            randomAccessFile.write(original ^ 0xFF);
        }
    }
}
