package com.corpusindex.pipeline;

/**
 * 产生致命错误的流水线阶段。
 */
public enum PipelineStage {
    /** 文档枚举 */
    SOURCE,
    /** 读取、解码与分词 */
    TOKENIZE,
    /** 片段合并 */
    MERGE,
    /** 桶落盘与提交 */
    STORAGE,
    /** 协调器：超时或线程异常退出 */
    COORDINATOR
}
