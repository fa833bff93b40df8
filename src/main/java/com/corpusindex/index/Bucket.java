package com.corpusindex.index;

import com.corpusindex.storage.BucketEntry;
import com.corpusindex.storage.Posting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 合并索引中的一个桶：共享同一前缀的词及其倒排项。仅由合并线程访问。
 */
public final class Bucket {
    private final String key;
    private Map<String, List<Posting>> postingsByWord = new HashMap<>();
    private BucketState state = BucketState.OPEN;
    private long postingCount;
    private long residentPostingCount;
    private int flushedWordCount;

    public Bucket(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("桶键不能为空");
        }
        this.key = key;
    }

    /**
     * 追加一个倒排项，词不存在时创建。
     */
    public void add(String word, Posting posting) {
        requireState(BucketState.OPEN);
        postingsByWord.computeIfAbsent(word, ignored -> new ArrayList<>()).add(posting);
        postingCount++;
        residentPostingCount++;
    }

    public void close() {
        requireState(BucketState.OPEN);
        state = BucketState.CLOSED;
    }

    /**
     * 按词序返回词条，每个词的倒排项按 docId 升序。
     *
     * @throws IllegalStateException 桶未关闭，或同一词出现重复 docId
     */
    public List<BucketEntry> sortedEntries() {
        requireState(BucketState.CLOSED);
        return sortResident();
    }

    /**
     * 取出内存中的有序词条用于溢写，桶保持 OPEN 并清空常驻倒排项。
     *
     * @throws IllegalStateException 桶不是 OPEN，或同一词出现重复 docId
     */
    public List<BucketEntry> spill() {
        requireState(BucketState.OPEN);
        List<BucketEntry> entries = sortResident();
        postingsByWord = new HashMap<>();
        residentPostingCount = 0;
        return entries;
    }

    private List<BucketEntry> sortResident() {
        List<String> words = new ArrayList<>(postingsByWord.keySet());
        words.sort(Comparator.naturalOrder());
        List<BucketEntry> entries = new ArrayList<>(words.size());
        for (String word : words) {
            List<Posting> postings = new ArrayList<>(postingsByWord.get(word));
            postings.sort(Comparator.comparingInt(Posting::docId));
            for (int index = 1; index < postings.size(); index++) {
                if (postings.get(index).docId() == postings.get(index - 1).docId()) {
                    throw new IllegalStateException("词 " + word + " 重复包含文档 " + postings.get(index).docId());
                }
            }
            entries.add(new BucketEntry(word, postings));
        }
        return entries;
    }

    /**
     * 标记已落盘并释放倒排内存。
     *
     * @param writtenWordCount 桶文件中的词数，包含溢写段中的词
     */
    public void markFlushed(int writtenWordCount) {
        requireState(BucketState.CLOSED);
        state = BucketState.FLUSHED;
        flushedWordCount = writtenWordCount;
        postingsByWord = Map.of();
        residentPostingCount = 0;
    }

    public String key() {
        return key;
    }

    public BucketState state() {
        return state;
    }

    /**
     * 落盘后为桶文件中的词数，之前为内存中的词数。
     */
    public int wordCount() {
        return state == BucketState.FLUSHED ? flushedWordCount : postingsByWord.size();
    }

    public long postingCount() {
        return postingCount;
    }

    /**
     * 仍在内存中、尚未溢写的倒排项数。
     */
    public long residentPostingCount() {
        return residentPostingCount;
    }

    private void requireState(BucketState expected) {
        if (state != expected) {
            throw new IllegalStateException("桶 " + key + " 状态为 " + state + "，期望 " + expected);
        }
    }
}
