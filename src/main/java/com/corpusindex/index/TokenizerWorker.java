package com.corpusindex.index;

import com.corpusindex.document.Document;
import com.corpusindex.pipeline.BoundedChannel;
import com.corpusindex.pipeline.FatalErrorSlot;
import com.corpusindex.pipeline.PipelineException;
import com.corpusindex.pipeline.PipelineStage;

import java.util.concurrent.Callable;

/**
 * 分词线程：从工作队列取文档，产出片段发往合并线程，收到毒丸后发送完成通知。
 */
public final class TokenizerWorker implements Callable<Integer> {
    private final int workerId;
    private final DocumentIndexer documentIndexer;
    private final BoundedChannel<Document> workQueue;
    private final BoundedChannel<FragmentMessage> fragmentQueue;
    private final FatalErrorSlot errorSlot;

    public TokenizerWorker(int workerId,
                           DocumentIndexer documentIndexer,
                           BoundedChannel<Document> workQueue,
                           BoundedChannel<FragmentMessage> fragmentQueue,
                           FatalErrorSlot errorSlot) {
        this.workerId = workerId;
        this.documentIndexer = documentIndexer;
        this.workQueue = workQueue;
        this.fragmentQueue = fragmentQueue;
        this.errorSlot = errorSlot;
    }

    /**
     * @return 本线程处理的文档数
     */
    @Override
    public Integer call() {
        int processed = 0;
        Integer currentDocId = null;
        try {
            while (true) {
                Document document = workQueue.receive();
                if (document == null) {
                    reportInterruptedWait();
                    return processed;
                }
                if (document.isPoison()) {
                    fragmentQueue.send(new FragmentMessage.WorkerDone(workerId));
                    return processed;
                }
                currentDocId = document.docId();
                FragmentMessage message = documentIndexer.index(document);
                processed++;
                if (!fragmentQueue.send(message)) {
                    reportInterruptedWait();
                    return processed;
                }
                currentDocId = null;
            }
        } catch (PipelineException exception) {
            errorSlot.trySet(exception);
        } catch (RuntimeException | Error throwable) {
            errorSlot.trySet(PipelineException.unexpected(PipelineStage.TOKENIZE, currentDocId, throwable));
        }
        return processed;
    }

    private void reportInterruptedWait() {
        if (!errorSlot.isSet()) {
            errorSlot.trySet(new PipelineException(PipelineStage.COORDINATOR,
                "分词线程 " + workerId + " 等待通道时被中断", null));
        }
    }
}
