package com.corpusindex.pipeline;

/**
 * 协调器状态：IDLE → RUNNING → DRAINING → COMPLETED | FAILED。
 */
public enum PipelineState {
    IDLE,
    RUNNING,
    DRAINING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
