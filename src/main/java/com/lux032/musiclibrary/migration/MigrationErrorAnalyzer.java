package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;

/**
 * 迁移错误分析
 *
 * <p>先按异常类型判断，再看 FileSystemException 的 reason 和异常消息文本，
 * 都识别不了的归为 UNKNOWN。
 */
@Slf4j
public class MigrationErrorAnalyzer {

    private static final String[] DISK_SPACE_PATTERNS = {
            "no space left", "disk quota", "not enough space", "disk full"
    };
    private static final String[] FILE_LOCK_PATTERNS = {
            "device or resource busy", "resource busy", "text file busy",
            "being used by another process", "file is locked", "sharing violation"
    };
    private static final String[] PERMISSION_PATTERNS = {
            "permission denied", "operation not permitted", "access is denied", "read-only file system"
    };

    public ErrorClassification classify(Throwable error, MigrationContext context) {
        MigrationErrorType type = detectType(error);

        ErrorClassification classification = new ErrorClassification();
        classification.setErrorType(type);
        classification.setSeverity(type.getSeverity());
        classification.setTechnicalMessage(error.getClass().getSimpleName() + ": " + error.getMessage());
        classification.setContext(context);
        classification.setRollbackAvailable(context != null && context.isRollbackAvailable());

        boolean force = context != null && context.isForce();
        RecoveryAction action = type.getDefaultAction();
        if (type == MigrationErrorType.TARGET_EXISTS && !force) {
            action = RecoveryAction.MANUAL_INTERVENTION;
        }
        classification.setRecoveryAction(action);
        classification.setRetryable(type.isRetryable() && action != RecoveryAction.MANUAL_INTERVENTION);
        classification.setManualInterventionRequired(action == RecoveryAction.MANUAL_INTERVENTION
                || action == RecoveryAction.ABORT_MIGRATION);

        String album = context != null ? context.getAlbumName() : "";
        String source = context != null ? context.getSourcePath() : "";
        String target = context != null ? context.getTargetPath() : "";
        classification.setUserMessage(I18nUtil.getMessage("migration.error." + type.getMessageKey(), album));
        classification.setSolutionSteps(I18nUtil.getMessageList(
                "migration.solution." + type.getMessageKey(), source, target));

        log.debug("迁移错误分类: {} -> {} ({})", classification.getTechnicalMessage(), type, action);
        return classification;
    }

    MigrationErrorType detectType(Throwable error) {
        // 沿 cause 链查找，包装过的 IO 异常也能识别
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            MigrationErrorType type = detectSingle(current);
            if (type != MigrationErrorType.UNKNOWN) {
                return type;
            }
            current = current.getCause();
            depth++;
        }
        return MigrationErrorType.UNKNOWN;
    }

    private MigrationErrorType detectSingle(Throwable error) {
        if (error instanceof AccessDeniedException || error instanceof SecurityException) {
            return MigrationErrorType.PERMISSION_DENIED;
        }
        if (error instanceof NoSuchFileException) {
            return MigrationErrorType.SOURCE_NOT_FOUND;
        }
        if (error instanceof FileAlreadyExistsException || error instanceof DirectoryNotEmptyException) {
            return MigrationErrorType.TARGET_EXISTS;
        }
        if (error instanceof OverlappingFileLockException) {
            return MigrationErrorType.FILE_LOCKED;
        }

        String text = error.getMessage();
        if (error instanceof FileSystemException && ((FileSystemException) error).getReason() != null) {
            text = ((FileSystemException) error).getReason();
        }
        MigrationErrorType byText = detectByText(text);
        if (byText != MigrationErrorType.UNKNOWN) {
            return byText;
        }

        // FileNotFoundException 也用于权限不足，上面已按消息文本排除
        if (error instanceof FileNotFoundException) {
            return MigrationErrorType.SOURCE_NOT_FOUND;
        }
        return MigrationErrorType.UNKNOWN;
    }

    private MigrationErrorType detectByText(String text) {
        if (text == null || text.isEmpty()) {
            return MigrationErrorType.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, DISK_SPACE_PATTERNS)) {
            return MigrationErrorType.DISK_SPACE_INSUFFICIENT;
        }
        if (containsAny(lower, FILE_LOCK_PATTERNS)) {
            return MigrationErrorType.FILE_LOCKED;
        }
        if (containsAny(lower, PERMISSION_PATTERNS)) {
            return MigrationErrorType.PERMISSION_DENIED;
        }
        return MigrationErrorType.UNKNOWN;
    }

    private static boolean containsAny(String text, String[] patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
