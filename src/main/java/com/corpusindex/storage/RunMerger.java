package com.corpusindex.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 多路归并按词序排列的词条来源。
 *
 * 同一个词出现在多个来源时，倒排项合并后按 docId 升序排列。
 * 每个文档只会被合并一次，因此同一个词在不同来源中不应出现相同的 docId。
 */
public final class RunMerger {

    private RunMerger() {
    }

    /**
     * 归并结果的接收方。
     */
    @FunctionalInterface
    public interface EntrySink {
        void accept(BucketEntry entry) throws IOException;
    }

    /**
     * 归并全部来源并按词序交给接收方，不关闭来源。
     *
     * @throws IOException 读取来源或写入接收方失败
     * @throws IllegalStateException 同一个词在不同来源中出现相同 docId
     */
    public static void merge(List<? extends EntrySource> sources, EntrySink sink) throws IOException {
        PriorityQueue<Head> heads = new PriorityQueue<>(
            Comparator.comparing((Head head) -> head.entry.word()).thenComparingInt(head -> head.sourceIndex));
        for (int index = 0; index < sources.size(); index++) {
            advance(heads, sources.get(index), index);
        }

        while (!heads.isEmpty()) {
            Head first = heads.poll();
            String word = first.entry.word();
            List<Posting> postings = new ArrayList<>(first.entry.postings());
            advance(heads, first.source, first.sourceIndex);
            while (!heads.isEmpty() && heads.peek().entry.word().equals(word)) {
                Head same = heads.poll();
                postings.addAll(same.entry.postings());
                advance(heads, same.source, same.sourceIndex);
            }
            postings.sort(Comparator.comparingInt(Posting::docId));
            for (int index = 1; index < postings.size(); index++) {
                if (postings.get(index).docId() == postings.get(index - 1).docId()) {
                    throw new IllegalStateException("词 " + word + " 在多个溢写段中重复包含文档 " + postings.get(index).docId());
                }
            }
            sink.accept(new BucketEntry(word, postings));
        }
    }

    /**
     * 归并为内存列表。
     */
    public static List<BucketEntry> mergeToList(List<? extends EntrySource> sources) throws IOException {
        List<BucketEntry> merged = new ArrayList<>();
        merge(sources, merged::add);
        return merged;
    }

    private static void advance(PriorityQueue<Head> heads, EntrySource source, int sourceIndex) throws IOException {
        BucketEntry next = source.next();
        if (next != null) {
            heads.add(new Head(next, source, sourceIndex));
        }
    }

    private static final class Head {
        private final BucketEntry entry;
        private final EntrySource source;
        private final int sourceIndex;

        private Head(BucketEntry entry, EntrySource source, int sourceIndex) {
            this.entry = entry;
            this.source = source;
            this.sourceIndex = sourceIndex;
        }
    }
}
