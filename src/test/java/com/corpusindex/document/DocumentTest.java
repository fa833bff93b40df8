package com.corpusindex.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void testPoisonIsIdentityOnly() {
        assertTrue(Document.POISON.isPoison());
        Document lookalike = new Document(Document.POISON.docId(), Document.POISON.path(), Document.POISON.sizeBytes());
        assertFalse(lookalike.isPoison());
    }

    @Test
    void testNullPathRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Document(1, null, 0));
    }

    @Test
    void testRecordFactories() {
        Document document = new Document(7, Path.of("/corpus/doc.txt"), 42);

        DocumentRecord indexed = DocumentRecord.indexed(document, 12);
        assertEquals(DocumentStatus.INDEXED, indexed.status());
        assertEquals(12, indexed.tokenCount());
        assertNull(indexed.reason());

        DocumentRecord skipped = DocumentRecord.skipped(document, "文件不存在");
        assertEquals(DocumentStatus.SKIPPED, skipped.status());
        assertEquals(0, skipped.tokenCount());
        assertEquals("文件不存在", skipped.reason());
        assertEquals(42, skipped.sizeBytes());
    }

    @Test
    void testFileContentReaderReadsBytes() throws IOException {
        Path file = tempDir.resolve("doc.txt");
        Files.writeString(file, "hello world");

        byte[] content = new FileContentReader().read(new Document(1, file, Files.size(file)));

        assertEquals("hello world", new String(content));
    }

    @Test
    void testFileContentReaderMissingFile() {
        Document missing = new Document(1, tempDir.resolve("gone.txt"), 0);
        assertThrows(NoSuchFileException.class, () -> new FileContentReader().read(missing));
    }
}
