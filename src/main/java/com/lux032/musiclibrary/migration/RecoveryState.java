package com.lux032.musiclibrary.migration;

/**
 * 恢复状态机
 *
 * <p>DETECTED → PLAN_BUILT → RETRYING / WAITING_ON_LOCK / MANUAL_PENDING / SKIPPED → RESOLVED / ABANDONED。
 * ROLLED_BACK 只在整个迁移中止时记录。
 */
public enum RecoveryState {
    DETECTED,
    PLAN_BUILT,
    RETRYING,
    WAITING_ON_LOCK,
    MANUAL_PENDING,
    SKIPPED,
    ROLLED_BACK,
    RESOLVED,
    ABANDONED
}
