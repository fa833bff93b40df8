package com.corpusindex.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RunMergerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("按词序归并，同词倒排项按 docId 合并")
    void testMergeByWord() throws IOException {
        EntrySource left = EntrySource.of(List.of(
            new BucketEntry("beta", List.of(new Posting(2, new int[]{0, 3}))),
            new BucketEntry("delta", List.of(new Posting(2, new int[]{1})))));
        EntrySource right = EntrySource.of(List.of(
            new BucketEntry("alpha", List.of(new Posting(5, new int[]{0}))),
            new BucketEntry("beta", List.of(new Posting(1, new int[]{4}), new Posting(7, new int[]{2})))));

        List<BucketEntry> merged = RunMerger.mergeToList(List.of(left, right));

        assertEquals(List.of("alpha", "beta", "delta"), merged.stream().map(BucketEntry::word).toList());
        assertEquals(List.of(1, 2, 7), merged.get(1).docIds());
        assertArrayEquals(new int[]{0, 3}, merged.get(1).postings().get(1).positions());
    }

    @Test
    @DisplayName("空来源与无来源")
    void testEmptySources() throws IOException {
        assertEquals(List.of(), RunMerger.mergeToList(List.of()));
        assertEquals(List.of(), RunMerger.mergeToList(List.of(EntrySource.of(List.of()), EntrySource.of(List.of()))));
    }

    @Test
    @DisplayName("同一词在两个来源中包含同一文档时报错")
    void testDuplicateDocRejected() {
        EntrySource first = EntrySource.of(List.of(new BucketEntry("dup", List.of(new Posting(3, new int[]{0})))));
        EntrySource second = EntrySource.of(List.of(new BucketEntry("dup", List.of(new Posting(3, new int[]{1})))));

        assertThrows(IllegalStateException.class, () -> RunMerger.mergeToList(List.of(first, second)));
    }

    @Test
    @DisplayName("BucketCursor 顺序读出桶文件全部词条后返回 null")
    void testCursorStreamsBucketFile() throws IOException {
        File bucketFile = tempDir.resolve("cursor.bkt").toFile();
        try (BucketWriter writer = new BucketWriter(bucketFile)) {
            writer.writeEntry(new BucketEntry("gamma", List.of(new Posting(1, new int[]{0}))));
            writer.writeEntry(new BucketEntry("omega", List.of(new Posting(2, new int[]{5, 9}))));
        }

        try (BucketCursor cursor = BucketCursor.open(bucketFile.toPath())) {
            assertEquals(2, cursor.getTermCount());
            assertEquals("gamma", cursor.next().word());
            assertArrayEquals(new int[]{5, 9}, cursor.next().postings().get(0).positions());
            assertNull(cursor.next());
            assertNull(cursor.next());
        }
    }
}
