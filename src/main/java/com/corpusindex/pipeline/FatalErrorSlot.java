package com.corpusindex.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次运行的致命错误槽：第一个写入者获胜，后续错误记录日志后丢弃。
 *
 * 槽被写入即代表取消信号，所有通道操作据此提前返回。
 */
public final class FatalErrorSlot {
    private static final Logger logger = LoggerFactory.getLogger(FatalErrorSlot.class);

    private final AtomicReference<PipelineException> firstError = new AtomicReference<>();
    private final Runnable onFirstError;

    public FatalErrorSlot() {
        this(() -> { });
    }

    /**
     * @param onFirstError 首个错误写入成功后，由写入线程执行一次
     */
    public FatalErrorSlot(Runnable onFirstError) {
        this.onFirstError = onFirstError;
    }

    /**
     * 尝试记录致命错误。
     *
     * @return 本次写入成为首个错误时返回 true
     */
    public boolean trySet(PipelineException error) {
        if (error == null) {
            throw new IllegalArgumentException("error 不能为空");
        }
        if (firstError.compareAndSet(null, error)) {
            logger.error("流水线致命错误 [{}]: {}", error.getStage(), error.getMessage(), error);
            onFirstError.run();
            return true;
        }
        logger.warn("已存在致命错误，丢弃后续错误 [{}]: {}", error.getStage(), error.getMessage());
        return false;
    }

    public boolean isSet() {
        return firstError.get() != null;
    }

    public Optional<PipelineException> get() {
        return Optional.ofNullable(firstError.get());
    }
}
