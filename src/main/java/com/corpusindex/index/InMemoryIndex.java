package com.corpusindex.index;

import com.corpusindex.text.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个文档的倒排片段：词到其在文档内全部位置的映射。
 *
 * 由一个分词线程构建，随后整体移交给合并线程，构建完成后不再修改。
 */
public final class InMemoryIndex {
    private final int docId;
    private final Map<String, int[]> positionsByWord;
    private final int wordCount;

    private InMemoryIndex(int docId, Map<String, int[]> positionsByWord, int wordCount) {
        this.docId = docId;
        this.positionsByWord = positionsByWord;
        this.wordCount = wordCount;
    }

    /**
     * 由分词结果构建片段，词位置按出现顺序严格递增。
     *
     * @param docId 文档 ID
     * @param tokens 分词结果
     * @return 文档片段
     */
    public static InMemoryIndex fromTokens(int docId, List<Token> tokens) {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (tokens == null) {
            throw new IllegalArgumentException("tokens不能为null");
        }
        Map<String, List<Integer>> collected = new HashMap<>();
        for (Token token : tokens) {
            collected.computeIfAbsent(token.term(), ignored -> new ArrayList<>()).add(token.position());
        }
        Map<String, int[]> positionsByWord = new HashMap<>(collected.size() * 2);
        for (Map.Entry<String, List<Integer>> entry : collected.entrySet()) {
            positionsByWord.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }
        return new InMemoryIndex(docId, positionsByWord, tokens.size());
    }

    public int docId() {
        return docId;
    }

    /**
     * 文档中词出现的总次数。
     */
    public int wordCount() {
        return wordCount;
    }

    public int distinctWordCount() {
        return positionsByWord.size();
    }

    public Set<String> words() {
        return Set.copyOf(positionsByWord.keySet());
    }

    /**
     * 返回词在文档中的位置，词不存在时返回空数组。
     */
    public int[] positions(String word) {
        int[] positions = positionsByWord.get(word);
        return positions == null ? new int[0] : Arrays.copyOf(positions, positions.length);
    }

    Map<String, int[]> positionsByWord() {
        return positionsByWord;
    }
}
