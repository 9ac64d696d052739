package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryError;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.util.FileSystemUtils;
import com.lux032.musiclibrary.util.I18nUtil;
import com.lux032.musiclibrary.util.LibraryLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 备份前的磁盘空间检查：需要目录大小的 1.1 倍再加上保留空间
 */
@Slf4j
public class DiskSpaceMonitor {

    private static final double SAFETY_FACTOR = 1.1;
    private static final long MB = 1024L * 1024L;

    private final long minFreeSpaceMb;

    public DiskSpaceMonitor(long minFreeSpaceMb) {
        this.minFreeSpaceMb = Math.max(0L, minFreeSpaceMb);
    }

    /**
     * 以前的迁移备份不会被再次备份，不计入大小
     */
    public long requiredBytes(Path folder) throws IOException {
        long size = FileSystemUtils.directorySize(folder, LibraryLayout::isMigrationBackup);
        return (long) Math.ceil(size * SAFETY_FACTOR) + minFreeSpaceMb * MB;
    }

    public long availableBytes(Path folder) throws IOException {
        return Files.getFileStore(folder).getUsableSpace();
    }

    public void ensureSpaceForBackup(Path bandFolder) throws LibraryException {
        long required;
        long available;
        try {
            required = requiredBytes(bandFolder);
            available = availableBytes(bandFolder);
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法检查磁盘空间: " + bandFolder, e);
        }

        if (available < required) {
            log.warn("磁盘空间不足: 需要 {}MB, 可用 {}MB", required / MB, available / MB);
            throw new LibraryException(LibraryError.of(ErrorKind.MIGRATION_DISK_SPACE,
                            I18nUtil.getMessage("migration.error.disk.space", bandFolder.getFileName()))
                    .withSolutionSteps(I18nUtil.getMessageList("migration.solution.disk.space",
                            bandFolder, ""))
                    .withDetail("required_bytes", required)
                    .withDetail("available_bytes", available));
        }
    }
}
