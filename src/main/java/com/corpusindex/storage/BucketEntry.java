package com.corpusindex.storage;

import java.util.List;

/**
 * 桶内一个词及其按文档 ID 升序排列的倒排项。
 */
public record BucketEntry(String word, List<Posting> postings) {
    public BucketEntry {
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("word 不能为空");
        }
        if (postings == null || postings.isEmpty()) {
            throw new IllegalArgumentException("postings 不能为空, word=" + word);
        }
        postings = List.copyOf(postings);
    }

    public int docFreq() {
        return postings.size();
    }

    public List<Integer> docIds() {
        return postings.stream().map(Posting::docId).toList();
    }
}
