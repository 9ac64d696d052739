package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.ErrorSeverity;
import com.lux032.musiclibrary.error.LibraryError;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.StructureType;
import com.lux032.musiclibrary.storage.SidecarLock;
import com.lux032.musiclibrary.util.FileSystemUtils;
import com.lux032.musiclibrary.util.I18nUtil;
import com.lux032.musiclibrary.util.JsonSupport;
import com.lux032.musiclibrary.util.LibraryLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 迁移前后的整目录备份
 *
 * <p>备份放在乐队目录下的 {@code .migration_backup_<时间戳>}，复制时跳过已有的迁移备份和锁文件。
 * 回滚时先清空乐队目录（保留备份目录），再从备份复制回来。
 */
@Slf4j
public class MigrationBackupManager {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Clock clock;

    public MigrationBackupManager(Clock clock) {
        this.clock = clock;
    }

    public BackupInfo createBackup(Path bandFolder, StructureType originalStructure) throws LibraryException {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        Path backupFolder = bandFolder.resolve(LibraryLayout.MIGRATION_BACKUP_PREFIX + timestamp);
        int suffix = 1;
        while (Files.exists(backupFolder)) {
            backupFolder = bandFolder.resolve(LibraryLayout.MIGRATION_BACKUP_PREFIX + timestamp + "_" + suffix++);
        }

        int[] counts;
        try {
            counts = FileSystemUtils.copyDirectoryRecursively(bandFolder, backupFolder, excludedFromBackup());
        } catch (IOException e) {
            cleanupQuietly(backupFolder);
            throw new LibraryException(ErrorKind.STORAGE_IO, "创建迁移备份失败: " + bandFolder, e);
        }

        BackupInfo info = new BackupInfo();
        info.setTimestamp(JsonSupport.now(clock));
        info.setBandName(bandFolder.getFileName().toString());
        info.setBackupFolderPath(backupFolder.toString());
        info.setOriginalStructureType(originalStructure);
        Path metadataBackup = backupFolder.resolve(BandDocument.FILE_NAME);
        info.setMetadataBackupPath(Files.exists(metadataBackup) ? metadataBackup.toString() : "");
        info.setFilesBackedUp(counts[0]);
        log.info("已创建迁移备份: {} ({} 个文件)", backupFolder, counts[0]);
        return info;
    }

    /**
     * 从备份恢复乐队目录，失败时抛出 MIGRATION_ROLLBACK，需要人工处理
     */
    public void restore(Path bandFolder, BackupInfo backup) throws LibraryException {
        Path backupFolder = Paths.get(backup.getBackupFolderPath());
        if (!Files.isDirectory(backupFolder)) {
            throw rollbackFailure(bandFolder, backupFolder, "备份目录不存在: " + backupFolder, null);
        }
        try {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(bandFolder)) {
                for (Path child : stream) {
                    if (!LibraryLayout.isMigrationBackup(child) && !isLockFile(child)) {
                        FileSystemUtils.deleteRecursively(child);
                    }
                }
            }
            FileSystemUtils.copyDirectoryRecursively(backupFolder, bandFolder, path -> false);
            log.info("已从备份恢复: {} <- {}", bandFolder, backupFolder);
        } catch (IOException e) {
            throw rollbackFailure(bandFolder, backupFolder, e.getMessage(), e);
        }
    }

    /**
     * 按时间从新到旧列出乐队目录下的迁移备份
     */
    public List<Path> listBackups(Path bandFolder) throws IOException {
        List<Path> backups = new ArrayList<>();
        for (Path child : FileSystemUtils.listSubdirectories(bandFolder)) {
            if (LibraryLayout.isMigrationBackup(child)) {
                backups.add(child);
            }
        }
        // 时间戳格式保证字典序即时间顺序
        backups.sort((a, b) -> b.getFileName().toString().compareTo(a.getFileName().toString()));
        return backups;
    }

    /**
     * 只保留最新的 keep 个迁移备份
     *
     * @return 删除的备份数
     */
    public int cleanupBackups(Path bandFolder, int keep) throws IOException {
        List<Path> backups = listBackups(bandFolder);
        int removed = 0;
        for (int i = Math.max(0, keep); i < backups.size(); i++) {
            FileSystemUtils.deleteRecursively(backups.get(i));
            removed++;
            log.info("已删除旧迁移备份: {}", backups.get(i));
        }
        return removed;
    }

    private static Predicate<Path> excludedFromBackup() {
        return path -> LibraryLayout.isMigrationBackup(path) || isLockFile(path);
    }

    private static boolean isLockFile(Path path) {
        return path.getFileName().toString().endsWith(SidecarLock.LOCK_SUFFIX);
    }

    private static LibraryException rollbackFailure(Path bandFolder, Path backupFolder, String reason, Throwable cause) {
        LibraryError error = LibraryError.of(ErrorKind.MIGRATION_ROLLBACK,
                I18nUtil.getMessage("migration.error.rollback", bandFolder.getFileName(), reason))
            .withSeverity(ErrorSeverity.CRITICAL)
            .withSolutionSteps(I18nUtil.getMessageList("migration.solution.rollback", backupFolder, bandFolder))
            .withDetail("backup_folder", backupFolder.toString())
            .withDetail("band_folder", bandFolder.toString());
        return cause != null ? new LibraryException(error, cause) : new LibraryException(error);
    }

    private static void cleanupQuietly(Path folder) {
        try {
            FileSystemUtils.deleteRecursively(folder);
        } catch (IOException e) {
            log.warn("清理未完成的备份失败: {} - {}", folder, e.getMessage());
        }
    }
}
