package com.corpusindex.storage;

import java.util.Arrays;

/**
 * 单个文档中某个词的倒排项：文档 ID 与该词在文档中的全部位置。
 *
 * @param docId 文档ID
 * @param positions 严格递增的词位置
 */
public record Posting(int docId, int[] positions) {
    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public Posting {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("positions不能为空，docId=" + docId);
        }
        for (int index = 0; index < positions.length; index++) {
            if (positions[index] < 0) {
                throw new IllegalArgumentException("position不能为负数，位置=" + index + ", value=" + positions[index]);
            }
            if (index > 0 && positions[index] <= positions[index - 1]) {
                throw new IllegalArgumentException("positions必须严格递增，位置=" + index + ", current=" + positions[index]);
            }
        }
        positions = Arrays.copyOf(positions, positions.length);
    }

    /**
     * 词在文档中的出现次数。
     */
    public int termFreq() {
        return positions.length;
    }

    @Override
    public int[] positions() {
        return Arrays.copyOf(positions, positions.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Posting posting)) {
            return false;
        }
        return docId == posting.docId && Arrays.equals(positions, posting.positions);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(docId) + Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return "Posting[docId=" + docId + ", positions=" + Arrays.toString(positions) + "]";
    }
}
