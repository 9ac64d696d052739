package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.ErrorSeverity;

/**
 * 迁移错误分类及其默认恢复策略
 */
public enum MigrationErrorType {
    PERMISSION_DENIED("permission", ErrorKind.MIGRATION_PERMISSION, ErrorSeverity.HIGH,
            false, RecoveryAction.MANUAL_INTERVENTION),
    DISK_SPACE_INSUFFICIENT("disk.space", ErrorKind.MIGRATION_DISK_SPACE, ErrorSeverity.CRITICAL,
            false, RecoveryAction.ABORT_MIGRATION),
    FILE_LOCKED("file.locked", ErrorKind.MIGRATION_FILE_LOCK, ErrorSeverity.HIGH,
            true, RecoveryAction.WAIT_AND_RETRY),
    SOURCE_NOT_FOUND("source.missing", ErrorKind.MIGRATION_PARTIAL_FAILURE, ErrorSeverity.MEDIUM,
            false, RecoveryAction.SKIP_ALBUM),
    TARGET_EXISTS("target.exists", ErrorKind.MIGRATION_PARTIAL_FAILURE, ErrorSeverity.MEDIUM,
            true, RecoveryAction.RETRY_WITH_MERGE),
    UNKNOWN("unknown", ErrorKind.MIGRATION_UNKNOWN, ErrorSeverity.MEDIUM,
            true, RecoveryAction.RETRY);

    private final String messageKey;
    private final ErrorKind errorKind;
    private final ErrorSeverity severity;
    private final boolean retryable;
    private final RecoveryAction defaultAction;

    MigrationErrorType(String messageKey, ErrorKind errorKind, ErrorSeverity severity,
                       boolean retryable, RecoveryAction defaultAction) {
        this.messageKey = messageKey;
        this.errorKind = errorKind;
        this.severity = severity;
        this.retryable = retryable;
        this.defaultAction = defaultAction;
    }

    public String getMessageKey() {
        return messageKey;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public RecoveryAction getDefaultAction() {
        return defaultAction;
    }
}
