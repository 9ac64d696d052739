package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.util.I18nUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("迁移错误恢复测试")
class MigrationRecoveryManagerTest {

    private final MigrationErrorAnalyzer analyzer = new MigrationErrorAnalyzer();
    private final Path albumPath = Paths.get("music", "The Beatles", "1969 - Abbey Road");

    private RecoveryLog recoveryLog;
    private FileLockDetector lockDetector;
    private MigrationRecoveryManager manager;

    @BeforeEach
    void setUp() {
        I18nUtil.init("en_US");
        recoveryLog = new RecoveryLog();
        lockDetector = mock(FileLockDetector.class);
        manager = new MigrationRecoveryManager(recoveryLog, analyzer, lockDetector, 3,
            Duration.ofMillis(50), Duration.ofMillis(1), Clock.systemDefaultZone());
    }

    private ErrorClassification classify(IOException error, boolean force) {
        MigrationOperation operation = new MigrationOperation("Abbey Road", "1969 - Abbey Road",
            "Album/1969 - Abbey Road", AlbumType.ALBUM, OperationType.MOVE);
        return analyzer.classify(error, new MigrationContext("The Beatles", operation, true, force));
    }

    private static List<RecoveryState> states(RecoveryOutcome outcome) {
        List<RecoveryState> states = new ArrayList<>();
        for (RecoveryLogEntry entry : outcome.getTransitions()) {
            states.add(entry.getState());
        }
        return states;
    }

    @Test
    @DisplayName("未知错误重试成功后解决")
    void recover_unknown_retriesUntilResolved() {
        AtomicInteger calls = new AtomicInteger();
        RecoveryOutcome outcome = manager.recover(classify(new IOException("glitch"), false), albumPath, merge -> {
            if (calls.incrementAndGet() < 2) {
                throw new IOException("glitch");
            }
        });

        assertTrue(outcome.isResolved());
        assertEquals(2, outcome.getAttempts());
        assertEquals(2, outcome.getClassification().getRetryCount());
        List<RecoveryState> states = states(outcome);
        assertEquals(RecoveryState.DETECTED, states.get(0));
        assertEquals(RecoveryState.PLAN_BUILT, states.get(1));
        assertEquals(RecoveryState.RESOLVED, states.get(states.size() - 1));
        assertEquals(outcome.getTransitions().size(), recoveryLog.size());
    }

    @Test
    @DisplayName("重试次数用尽后转人工处理")
    void recover_retriesExhausted_manualPending() {
        AtomicInteger calls = new AtomicInteger();
        RecoveryOutcome outcome = manager.recover(classify(new IOException("glitch"), false), albumPath, merge -> {
            calls.incrementAndGet();
            throw new IOException("still broken");
        });

        assertEquals(RecoveryState.MANUAL_PENDING, outcome.getFinalState());
        assertTrue(outcome.isBlocking());
        assertEquals(3, calls.get());
        assertEquals("IOException: still broken", outcome.getLastErrorMessage());
    }

    @Test
    @DisplayName("重试中出现不可重试的新错误时停止")
    void recover_differentFatalError_stopsRetrying() {
        AtomicInteger calls = new AtomicInteger();
        RecoveryOutcome outcome = manager.recover(classify(new IOException("glitch"), false), albumPath, merge -> {
            calls.incrementAndGet();
            throw new AccessDeniedException("/music");
        });

        assertEquals(RecoveryState.MANUAL_PENDING, outcome.getFinalState());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("源文件夹不存在时跳过专辑")
    void recover_sourceMissing_skipped() {
        RecoveryOutcome outcome = manager.recover(classify(new NoSuchFileException("/a"), false), albumPath,
            merge -> fail("不应重试"));

        assertTrue(outcome.isSkipped());
        assertFalse(outcome.isBlocking());
        assertEquals(0, outcome.getAttempts());
    }

    @Test
    @DisplayName("权限错误直接转人工处理")
    void recover_permission_manualPending() {
        RecoveryOutcome outcome = manager.recover(classify(new AccessDeniedException("/a"), false), albumPath,
            merge -> fail("不应重试"));

        assertEquals(RecoveryState.MANUAL_PENDING, outcome.getFinalState());
    }

    @Test
    @DisplayName("磁盘空间不足放弃")
    void recover_diskSpace_abandoned() {
        RecoveryOutcome outcome = manager.recover(
            classify(new FileSystemException("/a", null, "No space left on device"), false), albumPath,
            merge -> fail("不应重试"));

        assertEquals(RecoveryState.ABANDONED, outcome.getFinalState());
        assertTrue(outcome.isBlocking());
    }

    @Test
    @DisplayName("文件被占用: 等锁释放后重试")
    void recover_fileLocked_waitsThenRetries() {
        when(lockDetector.waitForRelease(eq(albumPath), any(Duration.class), any(Duration.class))).thenReturn(true);

        RecoveryOutcome outcome = manager.recover(
            classify(new FileSystemException("/a", null, "Device or resource busy"), false), albumPath,
            merge -> assertFalse(merge));

        assertTrue(outcome.isResolved());
        assertTrue(states(outcome).contains(RecoveryState.WAITING_ON_LOCK));
    }

    @Test
    @DisplayName("文件锁一直不释放时转人工处理")
    void recover_fileLockNeverReleased_manualPending() {
        when(lockDetector.waitForRelease(eq(albumPath), any(Duration.class), any(Duration.class))).thenReturn(false);
        AtomicInteger calls = new AtomicInteger();

        RecoveryOutcome outcome = manager.recover(
            classify(new FileSystemException("/a", null, "Device or resource busy"), false), albumPath,
            merge -> calls.incrementAndGet());

        assertEquals(RecoveryState.MANUAL_PENDING, outcome.getFinalState());
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("强制模式下目标已存在时合并")
    void recover_targetExistsWithForce_merges() {
        List<Boolean> mergeFlags = new ArrayList<>();
        RecoveryOutcome outcome = manager.recover(
            classify(new FileAlreadyExistsException("/b"), true), albumPath, mergeFlags::add);

        assertTrue(outcome.isResolved());
        assertEquals(1, mergeFlags.size());
        assertTrue(mergeFlags.get(0));
        verify(lockDetector, never()).waitForRelease(any(), any(), any());
    }

    @Test
    @DisplayName("回滚记录写入恢复日志")
    void recordRollback_addsEntry() {
        RecoveryLogEntry entry = manager.recordRollback("The Beatles", MigrationErrorType.PERMISSION_DENIED, "restored");

        assertEquals(RecoveryState.ROLLED_BACK, entry.getState());
        assertNull(entry.getAlbumName());
        assertEquals(1, recoveryLog.getRecentEntries(10).size());
    }

    @Test
    @DisplayName("恢复日志超过上限时丢弃最旧条目")
    void recoveryLog_bounded() {
        RecoveryLog small = new RecoveryLog(2);
        for (int i = 0; i < 5; i++) {
            small.add(new RecoveryLogEntry("t" + i, "Band", null, MigrationErrorType.UNKNOWN,
                RecoveryState.DETECTED, "m" + i));
        }

        assertEquals(2, small.size());
        assertEquals("m3", small.getEntries().get(0).getMessage());
        assertEquals("m4", small.getRecentEntries(1).get(0).getMessage());
    }
}
