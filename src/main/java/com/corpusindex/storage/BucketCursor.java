package com.corpusindex.storage;

import com.corpusindex.config.Constants;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 顺序读取桶文件格式的词条，内存中只保留当前词条。
 *
 * 打开时先校验 CRC32 页脚和文件头，随后每次 {@link #next} 解码一个词条并校验词序、docId 与位置顺序。
 * 读完 termCount 个词条后若数据区仍有剩余字节则视为损坏。
 */
public final class BucketCursor implements EntrySource {
    private static final int HEADER_BYTES = Integer.BYTES + Short.BYTES + Integer.BYTES;

    private final String fileName;
    private final LimitedInputStream limitedInput;
    private final DataInputStream input;
    private final int termCount;
    private int readCount;
    private String previousWord;

    private BucketCursor(String fileName, LimitedInputStream limitedInput, DataInputStream input, int termCount) {
        this.fileName = fileName;
        this.limitedInput = limitedInput;
        this.input = input;
        this.termCount = termCount;
    }

    /**
     * 打开桶文件或溢写段。
     *
     * @throws IOException 文件损坏或无法读取时抛出
     */
    public static BucketCursor open(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("桶文件不能为空");
        }
        String fileName = file.getFileName().toString();
        long dataLength;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "r")) {
            dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, fileName);
        }
        if (dataLength < HEADER_BYTES) {
            throw new IOException("桶文件过短: " + fileName);
        }

        LimitedInputStream limitedInput = new LimitedInputStream(
            new BufferedInputStream(Files.newInputStream(file)), dataLength);
        DataInputStream input = new DataInputStream(limitedInput);
        try {
            int magic = input.readInt();
            if (magic != Constants.BUCKET_MAGIC) {
                throw new IOException("桶文件 magic 不匹配: " + fileName);
            }
            short version = input.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("桶文件版本不支持: " + version);
            }
            int termCount = input.readInt();
            if (termCount < 0) {
                throw new IOException("桶termCount非法: " + termCount + ", file=" + fileName);
            }
            return new BucketCursor(fileName, limitedInput, input, termCount);
        } catch (IOException exception) {
            try {
                input.close();
            } catch (IOException closeException) {
                exception.addSuppressed(closeException);
            }
            throw exception;
        }
    }

    @Override
    public BucketEntry next() throws IOException {
        if (readCount == termCount) {
            if (limitedInput.remaining() > 0) {
                throw new IOException("桶文件包含未解析字节，可能已损坏: " + fileName);
            }
            return null;
        }
        String word = readWord(readCount);
        if (previousWord != null && word.compareTo(previousWord) <= 0) {
            throw new IOException("桶词序损坏，word 未严格递增: " + word);
        }
        int docFreq = VarIntCodec.readVarInt(input);
        if (docFreq <= 0) {
            throw new IOException("docFreq非法: word=" + word + ", docFreq=" + docFreq);
        }
        BucketEntry entry = new BucketEntry(word, readPostings(word, docFreq));
        readCount++;
        previousWord = word;
        return entry;
    }

    /**
     * 文件头声明的词条数。
     */
    public int getTermCount() {
        return termCount;
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    private String readWord(int index) throws IOException {
        int wordLength = VarIntCodec.readVarInt(input);
        if (wordLength <= 0 || wordLength > limitedInput.remaining()) {
            throw new IOException("词长度非法: index=" + index + ", wordLength=" + wordLength);
        }
        byte[] wordBytes = new byte[wordLength];
        input.readFully(wordBytes);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(wordBytes))
                .toString();
        } catch (CharacterCodingException exception) {
            throw new IOException("词字节不是合法 UTF-8: index=" + index, exception);
        }
    }

    private List<Posting> readPostings(String word, int docFreq) throws IOException {
        List<Posting> postings = new ArrayList<>(Math.min(docFreq, 1024));
        int previousDocId = -1;
        for (int postingIndex = 0; postingIndex < docFreq; postingIndex++) {
            int docIdDelta = VarIntCodec.readVarInt(input);
            if (postingIndex > 0 && docIdDelta == 0) {
                throw new IOException("docId 未严格递增: word=" + word + ", index=" + postingIndex);
            }
            int docId = postingIndex == 0 ? docIdDelta : previousDocId + docIdDelta;
            int termFreq = VarIntCodec.readVarInt(input);
            if (termFreq <= 0 || termFreq > limitedInput.remaining()) {
                throw new IOException("termFreq非法: word=" + word + ", docId=" + docId + ", termFreq=" + termFreq);
            }
            int[] positionDeltas = new int[termFreq];
            for (int positionIndex = 0; positionIndex < termFreq; positionIndex++) {
                positionDeltas[positionIndex] = VarIntCodec.readVarInt(input);
                if (positionIndex > 0 && positionDeltas[positionIndex] == 0) {
                    throw new IOException("位置未严格递增: word=" + word + ", docId=" + docId);
                }
            }
            postings.add(new Posting(docId, DeltaCodec.decode(positionDeltas)));
            previousDocId = docId;
        }
        return postings;
    }

    /**
     * 只暴露数据区，不让解析越过 CRC32 页脚。
     */
    private static final class LimitedInputStream extends FilterInputStream {
        private long remaining;

        LimitedInputStream(InputStream in, long limit) {
            super(in);
            this.remaining = limit;
        }

        long remaining() {
            return remaining;
        }

        @Override
        public int read() throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int value = super.read();
            if (value < 0) {
                throw new EOFException("桶文件数据区提前结束");
            }
            remaining--;
            return value;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int count = super.read(buffer, offset, (int) Math.min(length, remaining));
            if (count > 0) {
                remaining -= count;
            }
            return count;
        }

        @Override
        public long skip(long count) throws IOException {
            long skipped = super.skip(Math.min(count, remaining));
            remaining -= skipped;
            return skipped;
        }
    }
}
