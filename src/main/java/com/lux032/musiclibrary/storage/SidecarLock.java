package com.lux032.musiclibrary.storage;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryError;
import com.lux032.musiclibrary.error.LibraryException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * 文档旁路锁文件 {@code <file>.lock}
 * 通过 CREATE_NEW 原子创建获取，释放时删除；文件内容是持有者的进程号
 */
@Slf4j
public final class SidecarLock implements AutoCloseable {

    public static final String LOCK_SUFFIX = ".lock";

    private static final long INITIAL_BACKOFF_MILLIS = 25;
    private static final long MAX_BACKOFF_MILLIS = 400;

    private final Path lockFile;
    private boolean released;

    private SidecarLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    public static Path lockFileFor(Path target) {
        return target.resolveSibling(target.getFileName() + LOCK_SUFFIX);
    }

    /**
     * 获取锁，超时后抛出 LOCK_TIMEOUT
     */
    public static SidecarLock acquire(Path target, Duration timeout) throws LibraryException {
        Path lockFile = lockFileFor(target);
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法创建目录: " + lockFile.getParent(), e);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        long backoff = INITIAL_BACKOFF_MILLIS;
        byte[] owner = String.valueOf(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8);

        while (true) {
            try {
                Files.write(lockFile, owner, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.trace("获取锁: {}", lockFile);
                return new SidecarLock(lockFile);
            } catch (FileAlreadyExistsException e) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    throw new LibraryException(LibraryError.of(ErrorKind.LOCK_TIMEOUT,
                            "等待文件锁超时 (" + timeout.getSeconds() + "s): " + target)
                        .withDetail("lock_file", lockFile.toString())
                        .withDetail("holder", readHolder(lockFile)));
                }
                sleep(Math.min(backoff, remainingMillis), target);
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
            } catch (IOException e) {
                throw new LibraryException(ErrorKind.STORAGE_IO, "无法创建锁文件: " + lockFile, e);
            }
        }
    }

    private static void sleep(long millis, Path target) throws LibraryException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LibraryException(ErrorKind.LOCK_TIMEOUT, "等待文件锁时被中断: " + target, e);
        }
    }

    private static String readHolder(Path lockFile) {
        try {
            return new String(Files.readAllBytes(lockFile), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            return "unknown";
        }
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(lockFile);
            log.trace("释放锁: {}", lockFile);
        } catch (IOException e) {
            log.warn("锁文件删除失败: {} - {}", lockFile, e.getMessage());
        }
    }
}
