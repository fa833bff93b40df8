package com.corpusindex.pipeline;

import com.corpusindex.document.Document;
import com.corpusindex.document.DocumentSource;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 投喂线程：从文档源依次取出文档放入工作队列，源耗尽后为每个分词线程发送一个毒丸。
 */
final class SourceFeeder implements Callable<Integer> {
    private final DocumentSource source;
    private final BoundedChannel<Document> workQueue;
    private final int workerCount;
    private final FatalErrorSlot errorSlot;
    private final Runnable onExhausted;

    SourceFeeder(DocumentSource source,
                 BoundedChannel<Document> workQueue,
                 int workerCount,
                 FatalErrorSlot errorSlot,
                 Runnable onExhausted) {
        this.source = source;
        this.workQueue = workQueue;
        this.workerCount = workerCount;
        this.errorSlot = errorSlot;
        this.onExhausted = onExhausted;
    }

    /**
     * @return 从文档源取出的文档数
     */
    @Override
    public Integer call() {
        int enumerated = 0;
        try {
            while (true) {
                Optional<Document> next = source.next();
                if (next.isEmpty()) {
                    break;
                }
                enumerated++;
                if (!workQueue.send(next.get())) {
                    reportInterruptedWait();
                    return enumerated;
                }
            }
            onExhausted.run();
            for (int index = 0; index < workerCount; index++) {
                if (!workQueue.send(Document.POISON)) {
                    break;
                }
            }
        } catch (IOException exception) {
            errorSlot.trySet(PipelineException.enumeration(exception.getMessage(), exception));
        } catch (RuntimeException | Error throwable) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.SOURCE, null, throwable));
        }
        return enumerated;
    }

    private void reportInterruptedWait() {
        if (!errorSlot.isSet()) {
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR, "投喂线程等待工作队列时被中断", null));
        }
    }
}
