package com.lux032.musiclibrary.migration;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * 检测专辑目录中的文件是否被其他程序占用
 *
 * <p>对目录内的每个文件尝试获取一次排他锁并立即释放；拿不到锁视为被占用。
 * 在不支持强制锁的平台上只能发现同样使用文件锁的程序。
 */
@Slf4j
public class FileLockDetector {

    public boolean isLocked(Path path) {
        if (path == null || !Files.exists(path)) {
            return false;
        }
        if (Files.isRegularFile(path)) {
            return isFileLocked(path);
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
            for (Path child : stream) {
                if (Files.isRegularFile(child) && isFileLocked(child)) {
                    return true;
                }
            }
        } catch (IOException e) {
            log.debug("无法检查目录锁状态: {} - {}", path, e.getMessage());
            return true;
        }
        return false;
    }

    /**
     * 在 maxWait 内按 checkInterval 轮询，直到锁释放
     *
     * @return 锁是否已释放
     */
    public boolean waitForRelease(Path path, Duration maxWait, Duration checkInterval) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        long intervalMillis = Math.max(1L, checkInterval.toMillis());
        while (isLocked(path)) {
            if (System.nanoTime() >= deadline) {
                log.warn("等待文件锁释放超时: {}", path);
                return false;
            }
            try {
                Thread.sleep(intervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private boolean isFileLocked(Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                return true;
            }
            lock.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            log.debug("无法打开文件检查锁: {} - {}", file, e.getMessage());
            return true;
        }
    }
}
