package com.corpusindex.storage;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 桶文件读取器，打开时校验 CRC32 并全量加载词条，同时校验词序与 docId 顺序。
 */
public final class BucketReader {

    private final TreeMap<String, BucketEntry> entriesByWord = new TreeMap<>();
    private final long postingCount;

    /**
     * 构造读取器并完成桶文件全量加载。
     *
     * @param file 桶文件
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public BucketReader(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("桶文件不能为空");
        }
        long totalPostings = 0;
        try (BucketCursor cursor = BucketCursor.open(file.toPath())) {
            BucketEntry entry;
            while ((entry = cursor.next()) != null) {
                entriesByWord.put(entry.word(), entry);
                totalPostings += entry.docFreq();
            }
        }
        this.postingCount = totalPostings;
    }

    /**
     * 精确查找词对应的词条。
     */
    public Optional<BucketEntry> lookup(String word) {
        return Optional.ofNullable(entriesByWord.get(word));
    }

    /**
     * 按词序返回全部词条。
     */
    public List<BucketEntry> entries() {
        return new ArrayList<>(entriesByWord.values());
    }

    public List<String> words() {
        return List.copyOf(entriesByWord.navigableKeySet());
    }

    public int getTermCount() {
        return entriesByWord.size();
    }

    public long getPostingCount() {
        return postingCount;
    }
}
