package com.corpusindex.index;

import com.corpusindex.document.Document;

/**
 * 分词线程发往合并线程的消息。消息发送后所有权随之转移，发送方不再访问其内容。
 */
public sealed interface FragmentMessage {

    /**
     * 成功分词的文档片段。
     */
    record Fragment(Document document, InMemoryIndex index) implements FragmentMessage {
    }

    /**
     * 按策略跳过的文档。
     */
    record Skipped(Document document, SkippedDocument skipped) implements FragmentMessage {
    }

    /**
     * 分词线程已处理完全部输入。
     */
    record WorkerDone(int workerId) implements FragmentMessage {
    }
}
