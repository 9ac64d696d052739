package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.ErrorSeverity;
import com.lux032.musiclibrary.error.LibraryError;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次迁移错误的分析结果
 */
@Data
public class ErrorClassification {
    private MigrationErrorType errorType;
    private ErrorSeverity severity;
    private String userMessage;
    private String technicalMessage;
    private List<String> solutionSteps = new ArrayList<>();
    private boolean retryable;
    private boolean manualInterventionRequired;
    private boolean rollbackAvailable;
    private RecoveryAction recoveryAction;
    private int retryCount;
    private MigrationContext context;

    public ErrorKind getErrorKind() {
        return errorType != null ? errorType.getErrorKind() : ErrorKind.MIGRATION_UNKNOWN;
    }

    public void incrementRetryCount() {
        retryCount++;
    }

    /**
     * 转成对外的统一错误结构
     */
    public LibraryError toLibraryError() {
        LibraryError error = LibraryError.of(getErrorKind(), userMessage)
                .withSeverity(severity)
                .withSolutionSteps(solutionSteps)
                .withDetail("technical_message", technicalMessage)
                .withDetail("retry_count", retryCount)
                .withDetail("rollback_available", rollbackAvailable);
        if (context != null) {
            error.withDetail("band_name", context.getBandName())
                    .withDetail("album_name", context.getAlbumName())
                    .withDetail("source_path", context.getSourcePath())
                    .withDetail("target_path", context.getTargetPath());
        }
        return error;
    }
}
