package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.util.LibraryLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("磁盘空间检查测试")
class DiskSpaceMonitorTest {

    @TempDir
    Path bandFolder;

    @Test
    @DisplayName("所需空间为目录大小的 1.1 倍，以前的迁移备份不计入")
    void requiredBytes_previousBackups_excluded() throws Exception {
        Path album = Files.createDirectories(bandFolder.resolve("1975 - A Night at the Opera"));
        Files.write(album.resolve("01 - Death on Two Legs.mp3"), new byte[1000]);
        Path oldBackup = Files.createDirectories(
            bandFolder.resolve(LibraryLayout.MIGRATION_BACKUP_PREFIX + "20240101_120000"));
        Files.write(oldBackup.resolve("01 - Death on Two Legs.mp3"), new byte[5000]);

        assertEquals((long) Math.ceil(1000 * 1.1), new DiskSpaceMonitor(0).requiredBytes(bandFolder));
    }

    @Test
    @DisplayName("保留空间按 MB 叠加")
    void requiredBytes_minFreeSpace_added() throws Exception {
        Files.write(bandFolder.resolve("cover.jpg"), new byte[100]);

        assertEquals((long) Math.ceil(100 * 1.1) + 2L * 1024L * 1024L, new DiskSpaceMonitor(2).requiredBytes(bandFolder));
    }
}
