package com.corpusindex.storage;

import com.corpusindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 桶文件写入器，按严格递增词序写入词条及其倒排与位置，关闭时回填词数并追加 CRC32。
 *
 * 文件布局：magic(int) | version(short) | termCount(int) | 词条* | crc32(int)。
 * 每个词条：varint 词长度、UTF-8 词字节、varint docFreq，随后每个倒排项依次写入
 * varint docId 差值、varint 词频与 varint 位置差值。
 */
public final class BucketWriter implements AutoCloseable {
    private static final long TERM_COUNT_OFFSET = Integer.BYTES + Short.BYTES;

    private final RandomAccessFile randomAccessFile;
    private final String bucketFileName;
    private final ByteArrayOutputStream entryBuffer = new ByteArrayOutputStream();
    private int termCount;
    private long postingCount;
    private long crc32;
    private String lastWord;
    private boolean closed;

    /**
     * 创建桶文件写入器并写入文件头。
     *
     * @param file 目标桶文件
     * @throws IOException 初始化失败时抛出
     */
    public BucketWriter(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("桶文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.bucketFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.BUCKET_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
        this.randomAccessFile.writeInt(0);
    }

    /**
     * 写入一个词条，要求 word 按字典序严格递增、倒排项按 docId 严格递增。
     *
     * @param entry 词条
     * @throws IOException 写入失败时抛出
     */
    public void writeEntry(BucketEntry entry) throws IOException {
        ensureOpen();
        if (entry == null) {
            throw new IllegalArgumentException("entry 不能为空");
        }
        String word = entry.word();
        if (lastWord != null && word.compareTo(lastWord) <= 0) {
            throw new IllegalArgumentException("word 必须严格递增，last=" + lastWord + ", current=" + word);
        }
        List<Posting> postings = entry.postings();
        int[] docIds = new int[postings.size()];
        for (int index = 0; index < docIds.length; index++) {
            docIds[index] = postings.get(index).docId();
        }
        int[] docIdDeltas;
        try {
            docIdDeltas = DeltaCodec.encode(docIds);
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("word=" + word + " 的倒排项 docId 非严格递增", exception);
        }

        entryBuffer.reset();
        byte[] wordBytes = word.getBytes(StandardCharsets.UTF_8);
        VarIntCodec.writeVarInt(wordBytes.length, entryBuffer);
        entryBuffer.write(wordBytes);
        VarIntCodec.writeVarInt(postings.size(), entryBuffer);
        for (int index = 0; index < docIdDeltas.length; index++) {
            int[] positions = postings.get(index).positions();
            VarIntCodec.writeVarInt(docIdDeltas[index], entryBuffer);
            VarIntCodec.writeVarInt(positions.length, entryBuffer);
            for (int positionDelta : DeltaCodec.encode(positions)) {
                VarIntCodec.writeVarInt(positionDelta, entryBuffer);
            }
        }
        randomAccessFile.write(entryBuffer.toByteArray());

        termCount++;
        postingCount += postings.size();
        lastWord = word;
    }

    public int getTermCount() {
        return termCount;
    }

    public long getPostingCount() {
        return postingCount;
    }

    /**
     * 关闭后可用：写入页脚的 CRC32 值。
     */
    public long getCrc32() {
        if (!closed) {
            throw new IllegalStateException("BucketWriter 尚未关闭");
        }
        return crc32;
    }

    /**
     * 回填 termCount 并写入 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(TERM_COUNT_OFFSET);
            randomAccessFile.writeInt(termCount);
            randomAccessFile.seek(randomAccessFile.length());
            crc32 = StorageFileUtil.appendCrc32Footer(randomAccessFile);
            StorageFileUtil.verifyCrc32Footer(randomAccessFile, bucketFileName);
            randomAccessFile.getFD().sync();
        } catch (IOException exception) {
            throw new IOException("关闭桶写入器失败: file=" + bucketFileName + ", termCount=" + termCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("BucketWriter 已关闭");
        }
    }
}
