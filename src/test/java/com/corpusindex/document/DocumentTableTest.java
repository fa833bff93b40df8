package com.corpusindex.document;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentTableTest {
    @TempDir
    Path tempDir;

    @Test
    void testInsertAllAndFindById() {
        Path dbPath = tempDir.resolve("catalog.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            Document readme = new Document(1, Path.of("/workspace/docs/readme.md"), 1024);
            documentTable.insertAll(List.of(DocumentRecord.indexed(readme, 120)));

            Optional<DocumentRecord> loaded = documentTable.findById(1);
            assertTrue(loaded.isPresent());
            assertEquals(Path.of("/workspace/docs/readme.md"), loaded.get().path());
            assertEquals(1024, loaded.get().sizeBytes());
            assertEquals(DocumentStatus.INDEXED, loaded.get().status());
            assertEquals(120, loaded.get().tokenCount());
            assertFalse(documentTable.findById(2).isPresent());
        }
    }

    @Test
    void testFindByStatusOrderedByDocId() {
        Path dbPath = tempDir.resolve("status.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.insertAll(List.of(
                DocumentRecord.skipped(new Document(5, Path.of("/c/e.txt"), 1), "内容不是合法的 UTF-8"),
                DocumentRecord.indexed(new Document(1, Path.of("/c/a.txt"), 1), 3),
                DocumentRecord.skipped(new Document(2, Path.of("/c/b.txt"), 1), "无读取权限"),
                DocumentRecord.indexed(new Document(3, Path.of("/c/c.txt"), 1), 4)
            ));

            List<DocumentRecord> skipped = documentTable.findByStatus(DocumentStatus.SKIPPED);
            assertEquals(List.of(2, 5), skipped.stream().map(DocumentRecord::docId).toList());
            assertEquals("无读取权限", skipped.get(0).reason());
            assertEquals(2, documentTable.findByStatus(DocumentStatus.INDEXED).size());
            assertEquals(4, documentTable.getTotalDocCount());
        }
    }

    @Test
    void testInsertAllRollsBackOnDuplicateId() {
        Path dbPath = tempDir.resolve("rollback.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            Document first = new Document(1, Path.of("/c/a.txt"), 1);
            List<DocumentRecord> duplicated = List.of(
                DocumentRecord.indexed(first, 1),
                DocumentRecord.indexed(new Document(2, Path.of("/c/b.txt"), 1), 1),
                DocumentRecord.indexed(first, 1)
            );

            assertThrows(IllegalStateException.class, () -> documentTable.insertAll(duplicated));
            assertEquals(0, documentTable.getTotalDocCount());

            documentTable.insertAll(List.of(DocumentRecord.indexed(first, 1)));
            assertEquals(1, documentTable.getTotalDocCount());
        }
    }

    @Test
    void testClear() {
        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("clear.db"))) {
            documentTable.insertAll(List.of(DocumentRecord.indexed(new Document(1, Path.of("/c/a.txt"), 1), 1)));
            documentTable.clear();
            assertEquals(0, documentTable.getTotalDocCount());
        }
    }

    @Test
    void testWalModeEnabled() {
        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("wal.db"))) {
            assertEquals("wal", documentTable.getJournalMode().toLowerCase());
        }
    }
}
