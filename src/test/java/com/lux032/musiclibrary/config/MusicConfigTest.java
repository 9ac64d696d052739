package com.lux032.musiclibrary.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("配置加载测试")
class MusicConfigTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("配置文件不存在时生成默认配置")
    void load_missingFile_writesDefaults() {
        Path file = dir.resolve("conf").resolve("config.properties");

        MusicConfig config = MusicConfig.load(file);

        assertTrue(Files.exists(file));
        assertEquals(30, config.getCacheDurationDays());
        assertEquals(3, config.getMigrationMaxRetries());
        assertEquals("en_US", config.getLanguage());
        assertFalse(config.isReadDurations());
    }

    @Test
    @DisplayName("读取配置值，无效的数字使用默认值")
    void load_existingFile() throws Exception {
        Path file = dir.resolve("config.properties");
        Files.write(file, Arrays.asList(
            "music.rootPath=" + dir.toString().replace('\\', '/'),
            "cache.durationDays=7",
            "migration.maxRetries=abc",
            "migration.minFreeSpaceMb=0",
            "scan.readDurations=true",
            "i18n.language=zh_CN"
        ), StandardCharsets.UTF_8);

        MusicConfig config = MusicConfig.load(file);

        assertEquals(dir, config.getMusicRoot());
        assertEquals(7, config.getCacheDurationDays());
        assertEquals(3, config.getMigrationMaxRetries());
        assertEquals(0, config.getMinFreeSpaceMb());
        assertTrue(config.isReadDurations());
        assertEquals("zh_CN", config.getLanguage());
        assertTrue(config.isValid());
    }

    @Test
    @DisplayName("保存后重新加载得到相同的值")
    void saveToFile_thenLoad() throws Exception {
        MusicConfig config = new MusicConfig(dir.toString());
        config.setLockWaitSeconds(5);
        config.setMaxBackups(2);
        Path file = dir.resolve("saved.properties");

        config.saveToFile(file);
        MusicConfig loaded = MusicConfig.load(file);

        assertEquals(config, loaded);
    }

    @Test
    @DisplayName("无效配置")
    void isValid_rejectsBadValues() {
        MusicConfig config = new MusicConfig(dir.toString());
        config.setCacheDurationDays(0);
        assertFalse(config.isValid());

        config = new MusicConfig(" ");
        assertFalse(config.isValid());

        config = new MusicConfig(dir.toString());
        config.setMigrationMaxRetries(-1);
        assertFalse(config.isValid());
    }
}
