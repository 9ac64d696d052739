package com.lux032.musiclibrary.error;

/**
 * 统一错误类型
 * 所有可见错误都通过该枚举区分，调用方按 kind 做分支处理
 */
public enum ErrorKind {
    // 参数或状态校验失败
    VALIDATION(ErrorCategory.VALIDATION, ErrorSeverity.MEDIUM),

    // 存储层
    STORAGE_IO(ErrorCategory.STORAGE, ErrorSeverity.HIGH),
    LOCK_TIMEOUT(ErrorCategory.STORAGE, ErrorSeverity.MEDIUM),
    DOCUMENT_NOT_FOUND(ErrorCategory.STORAGE, ErrorSeverity.LOW),
    DOCUMENT_CORRUPT(ErrorCategory.STORAGE, ErrorSeverity.HIGH),

    // 扫描
    SCANNING(ErrorCategory.SCANNING, ErrorSeverity.MEDIUM),

    // 迁移
    MIGRATION_PERMISSION(ErrorCategory.MIGRATION, ErrorSeverity.HIGH),
    MIGRATION_DISK_SPACE(ErrorCategory.MIGRATION, ErrorSeverity.CRITICAL),
    MIGRATION_FILE_LOCK(ErrorCategory.MIGRATION, ErrorSeverity.HIGH),
    MIGRATION_PARTIAL_FAILURE(ErrorCategory.MIGRATION, ErrorSeverity.MEDIUM),
    MIGRATION_ROLLBACK(ErrorCategory.MIGRATION, ErrorSeverity.CRITICAL),
    MIGRATION_UNKNOWN(ErrorCategory.MIGRATION, ErrorSeverity.MEDIUM);

    private final ErrorCategory category;
    private final ErrorSeverity defaultSeverity;

    ErrorKind(ErrorCategory category, ErrorSeverity defaultSeverity) {
        this.category = category;
        this.defaultSeverity = defaultSeverity;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * 回滚失败只能人工处理，不允许自动重试
     */
    public boolean isAutoRecoverable() {
        return this != MIGRATION_ROLLBACK && this != VALIDATION;
    }
}
