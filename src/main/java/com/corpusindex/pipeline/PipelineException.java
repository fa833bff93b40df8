package com.corpusindex.pipeline;

import com.corpusindex.config.ErrorKind;

import java.util.Optional;

/**
 * 流水线致命错误，携带出错阶段以及可选的文档 ID、桶键与错误类别。
 */
public class PipelineException extends RuntimeException {
    private final PipelineStage stage;
    private final Integer docId;
    private final String bucketKey;
    private final ErrorKind errorKind;

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        this(stage, message, cause, null, null, null);
    }

    private PipelineException(PipelineStage stage, String message, Throwable cause,
                              Integer docId, String bucketKey, ErrorKind errorKind) {
        super(message, cause);
        if (stage == null) {
            throw new IllegalArgumentException("stage 不能为空");
        }
        this.stage = stage;
        this.docId = docId;
        this.bucketKey = bucketKey;
        this.errorKind = errorKind;
    }

    public static PipelineException enumeration(String message, Throwable cause) {
        return new PipelineException(PipelineStage.SOURCE, "枚举文档失败: " + message, cause);
    }

    public static PipelineException document(int docId, ErrorKind errorKind, String message, Throwable cause) {
        return new PipelineException(PipelineStage.TOKENIZE,
            "文档 " + docId + " 处理失败 (" + errorKind + "): " + message, cause, docId, null, errorKind);
    }

    public static PipelineException mergeInvariant(int docId, String message) {
        return new PipelineException(PipelineStage.MERGE, "合并不变量被破坏: " + message, null, docId, null, null);
    }

    public static PipelineException storage(String bucketKey, String message, Throwable cause) {
        String prefix = bucketKey == null ? "存储失败: " : "桶 " + bucketKey + " 存储失败: ";
        return new PipelineException(PipelineStage.STORAGE, prefix + message, cause, null, bucketKey, null);
    }

    public static PipelineException deadlineExceeded(long deadlineMillis) {
        return new PipelineException(PipelineStage.COORDINATOR, "运行超过截止时间 " + deadlineMillis + "ms", null);
    }

    public static PipelineException unexpected(PipelineStage stage, Integer docId, Throwable cause) {
        String message = stage + " 阶段出现未预期异常: " + cause;
        return new PipelineException(stage, message, cause, docId, null, null);
    }

    public PipelineStage getStage() {
        return stage;
    }

    public Optional<Integer> getDocId() {
        return Optional.ofNullable(docId);
    }

    public Optional<String> getBucketKey() {
        return Optional.ofNullable(bucketKey);
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }
}
