package com.corpusindex.index;

/**
 * 以词的前 N 个码点作为桶键，保证桶按词序连续且互不重叠。
 */
public final class BucketPartitioner {
    private final int prefixLength;

    public BucketPartitioner(int prefixLength) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("prefixLength 必须 >= 1: " + prefixLength);
        }
        this.prefixLength = prefixLength;
    }

    public String bucketKey(String word) {
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("word 不能为空");
        }
        int codePointCount = word.codePointCount(0, word.length());
        if (codePointCount <= prefixLength) {
            return word;
        }
        return word.substring(0, word.offsetByCodePoints(0, prefixLength));
    }

    public int prefixLength() {
        return prefixLength;
    }
}
