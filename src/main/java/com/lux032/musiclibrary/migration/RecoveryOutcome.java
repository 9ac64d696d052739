package com.lux032.musiclibrary.migration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次恢复流程的结果
 */
@Data
public class RecoveryOutcome {
    // 终态: RESOLVED / SKIPPED / MANUAL_PENDING / ABANDONED
    private RecoveryState finalState;
    private ErrorClassification classification;
    private int attempts;
    private String lastErrorMessage;
    private List<RecoveryLogEntry> transitions = new ArrayList<>();

    public boolean isResolved() {
        return finalState == RecoveryState.RESOLVED;
    }

    public boolean isSkipped() {
        return finalState == RecoveryState.SKIPPED;
    }

    /**
     * 未解决也未跳过，迁移需要中止（force 时继续）
     */
    public boolean isBlocking() {
        return finalState == RecoveryState.MANUAL_PENDING || finalState == RecoveryState.ABANDONED;
    }
}
