package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * 迁移错误恢复
 *
 * <p>按错误分类选择恢复策略并执行，所有状态转换写入 {@link RecoveryLog}。
 * 重试次数有上限，超过后转人工处理。
 */
@Slf4j
public class MigrationRecoveryManager {

    private final RecoveryLog recoveryLog;
    private final MigrationErrorAnalyzer analyzer;
    private final FileLockDetector lockDetector;
    private final int maxRetries;
    private final Duration lockWait;
    private final Duration lockCheckInterval;
    private final Clock clock;

    public MigrationRecoveryManager(RecoveryLog recoveryLog, MigrationErrorAnalyzer analyzer,
                                    FileLockDetector lockDetector, int maxRetries,
                                    Duration lockWait, Duration lockCheckInterval, Clock clock) {
        this.recoveryLog = recoveryLog;
        this.analyzer = analyzer;
        this.lockDetector = lockDetector;
        this.maxRetries = Math.max(0, maxRetries);
        this.lockWait = lockWait;
        this.lockCheckInterval = lockCheckInterval;
        this.clock = clock;
    }

    public RecoveryLog getRecoveryLog() {
        return recoveryLog;
    }

    /**
     * 执行恢复流程
     *
     * @param lockedPath 等待文件锁时检查的路径
     */
    public RecoveryOutcome recover(ErrorClassification classification, Path lockedPath,
                                   RecoverableOperation operation) {
        RecoveryOutcome outcome = new RecoveryOutcome();
        outcome.setClassification(classification);
        outcome.setLastErrorMessage(classification.getTechnicalMessage());

        transition(outcome, RecoveryState.DETECTED, classification.getTechnicalMessage());
        RecoveryAction action = classification.getRecoveryAction() != null
                ? classification.getRecoveryAction()
                : classification.getErrorType().getDefaultAction();
        transition(outcome, RecoveryState.PLAN_BUILT, action.name());

        switch (action) {
            case SKIP_ALBUM:
                transition(outcome, RecoveryState.SKIPPED, classification.getUserMessage());
                break;
            case MANUAL_INTERVENTION:
                transition(outcome, RecoveryState.MANUAL_PENDING, String.join("; ", classification.getSolutionSteps()));
                break;
            case ABORT_MIGRATION:
                transition(outcome, RecoveryState.ABANDONED, classification.getUserMessage());
                break;
            case WAIT_AND_RETRY:
                transition(outcome, RecoveryState.WAITING_ON_LOCK, String.valueOf(lockedPath));
                if (!lockDetector.waitForRelease(lockedPath, lockWait, lockCheckInterval)) {
                    transition(outcome, RecoveryState.MANUAL_PENDING, "文件锁未在 " + lockWait.getSeconds() + " 秒内释放");
                    break;
                }
                retry(outcome, operation, false);
                break;
            case RETRY_WITH_MERGE:
                retry(outcome, operation, true);
                break;
            case RETRY:
            default:
                retry(outcome, operation, false);
                break;
        }
        return outcome;
    }

    /**
     * 迁移整体中止并回滚时记录
     */
    public RecoveryLogEntry recordRollback(String bandName, MigrationErrorType errorType, String message) {
        RecoveryLogEntry entry = new RecoveryLogEntry(JsonSupport.now(clock), bandName, null,
                errorType, RecoveryState.ROLLED_BACK, message);
        recoveryLog.add(entry);
        log.warn("迁移已回滚: {} - {}", bandName, message);
        return entry;
    }

    private void retry(RecoveryOutcome outcome, RecoverableOperation operation, boolean merge) {
        ErrorClassification classification = outcome.getClassification();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (attempt > 1 && !pause()) {
                transition(outcome, RecoveryState.ABANDONED, "重试被中断");
                return;
            }
            outcome.setAttempts(attempt);
            classification.incrementRetryCount();
            transition(outcome, RecoveryState.RETRYING, "第 " + attempt + "/" + maxRetries + " 次" + (merge ? "（合并）" : ""));
            try {
                operation.run(merge);
                transition(outcome, RecoveryState.RESOLVED, null);
                return;
            } catch (IOException | RuntimeException e) {
                outcome.setLastErrorMessage(e.getClass().getSimpleName() + ": " + e.getMessage());
                log.debug("重试失败: {}", outcome.getLastErrorMessage());

                // 重试时出现的是另一类不可重试错误，不再继续
                MigrationErrorType newType = analyzer.detectType(e);
                if (newType != classification.getErrorType() && !newType.isRetryable()) {
                    break;
                }
            }
        }
        transition(outcome, RecoveryState.MANUAL_PENDING, "重试失败: " + outcome.getLastErrorMessage());
    }

    private boolean pause() {
        try {
            Thread.sleep(Math.max(1L, lockCheckInterval.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void transition(RecoveryOutcome outcome, RecoveryState state, String message) {
        ErrorClassification classification = outcome.getClassification();
        MigrationContext context = classification.getContext();
        RecoveryLogEntry entry = new RecoveryLogEntry(JsonSupport.now(clock),
                context != null ? context.getBandName() : null,
                context != null ? context.getAlbumName() : null,
                classification.getErrorType(), state, message);
        recoveryLog.add(entry);
        outcome.getTransitions().add(entry);
        outcome.setFinalState(state);
        log.debug("恢复状态: {} [{}] {}", entry.getAlbumName(), state, message != null ? message : "");
    }
}
