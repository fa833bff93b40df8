package com.corpusindex.pipeline;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 为流水线线程命名：corpus-index-&lt;角色&gt;-&lt;序号&gt;。
 */
final class PipelineThreadFactory implements ThreadFactory {
    private final String role;
    private final AtomicInteger sequence = new AtomicInteger();

    PipelineThreadFactory(String role) {
        this.role = role;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, "corpus-index-" + role + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
