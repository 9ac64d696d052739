package com.lux032.musiclibrary.migration;

/**
 * 恢复策略
 */
public enum RecoveryAction {
    RETRY,
    WAIT_AND_RETRY,
    // 目标已存在时合并到目标目录
    RETRY_WITH_MERGE,
    SKIP_ALBUM,
    MANUAL_INTERVENTION,
    ABORT_MIGRATION
}
