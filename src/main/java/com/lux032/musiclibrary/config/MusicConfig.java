package com.lux032.musiclibrary.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 音乐库管理配置
 * 通过构造函数或 {@link #load(Path)} 显式创建，由调用方传递给各个服务
 */
@Slf4j
@Data
public class MusicConfig {

    public static final String DEFAULT_CONFIG_FILE = "config.properties";

    // 音乐库根目录
    private String musicRootPath;

    // 缓存配置
    private int cacheDurationDays;

    // 存储配置
    private int lockTimeoutSeconds;
    private int maxBackups;

    // 迁移配置
    private int migrationMaxRetries;
    private int lockWaitSeconds;      // 等待被占用文件释放的最长时间
    private long lockCheckIntervalMillis;
    private long minFreeSpaceMb;      // 迁移前要求保留的磁盘空间

    // 扫描配置
    private boolean readDurations;    // 是否读取音频时长（较慢）

    // 国际化配置
    private String language;

    public MusicConfig() {
        // 默认配置
        this.musicRootPath = System.getProperty("user.home") + "/Music";
        this.cacheDurationDays = 30;
        this.lockTimeoutSeconds = 10;
        this.maxBackups = 5;
        this.migrationMaxRetries = 3;
        this.lockWaitSeconds = 30;
        this.lockCheckIntervalMillis = 1000;
        this.minFreeSpaceMb = 1024;
        this.readDurations = false;
        this.language = "en_US";
    }

    public MusicConfig(String musicRootPath) {
        this();
        this.musicRootPath = musicRootPath;
    }

    public Path getMusicRoot() {
        return Paths.get(musicRootPath);
    }

    /**
     * 从配置文件加载，文件不存在时生成默认配置
     */
    public static MusicConfig load(Path configPath) {
        MusicConfig config = new MusicConfig();
        if (!Files.exists(configPath)) {
            log.info("配置文件不存在，生成默认配置: {}", configPath);
            try {
                config.saveToFile(configPath);
            } catch (IOException e) {
                log.warn("默认配置写入失败: {}", e.getMessage());
            }
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.error("配置文件读取失败，使用默认配置: {}", configPath, e);
            return config;
        }
        config.apply(props);
        log.info("配置文件加载成功: {}", configPath);
        return config;
    }

    void apply(Properties props) {
        if (props.containsKey("music.rootPath")) {
            this.musicRootPath = props.getProperty("music.rootPath").trim();
        }
        this.cacheDurationDays = parseInt(props, "cache.durationDays", cacheDurationDays);
        this.lockTimeoutSeconds = parseInt(props, "storage.lockTimeoutSeconds", lockTimeoutSeconds);
        this.maxBackups = parseInt(props, "storage.maxBackups", maxBackups);
        this.migrationMaxRetries = parseInt(props, "migration.maxRetries", migrationMaxRetries);
        this.lockWaitSeconds = parseInt(props, "migration.lockWaitSeconds", lockWaitSeconds);
        this.lockCheckIntervalMillis = parseLong(props, "migration.lockCheckIntervalMillis", lockCheckIntervalMillis);
        this.minFreeSpaceMb = parseLong(props, "migration.minFreeSpaceMb", minFreeSpaceMb);
        if (props.containsKey("scan.readDurations")) {
            this.readDurations = Boolean.parseBoolean(props.getProperty("scan.readDurations").trim());
        }
        if (props.containsKey("i18n.language")) {
            this.language = props.getProperty("i18n.language").trim();
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 不是有效整数: {}，使用默认值 {}", key, props.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 不是有效整数: {}，使用默认值 {}", key, props.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    public void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("music.rootPath", musicRootPath);
        props.setProperty("cache.durationDays", String.valueOf(cacheDurationDays));
        props.setProperty("storage.lockTimeoutSeconds", String.valueOf(lockTimeoutSeconds));
        props.setProperty("storage.maxBackups", String.valueOf(maxBackups));
        props.setProperty("migration.maxRetries", String.valueOf(migrationMaxRetries));
        props.setProperty("migration.lockWaitSeconds", String.valueOf(lockWaitSeconds));
        props.setProperty("migration.lockCheckIntervalMillis", String.valueOf(lockCheckIntervalMillis));
        props.setProperty("migration.minFreeSpaceMb", String.valueOf(minFreeSpaceMb));
        props.setProperty("scan.readDurations", String.valueOf(readDurations));
        props.setProperty("i18n.language", language);

        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(configPath)) {
            props.store(out, "Music library manager configuration");
        }
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (musicRootPath == null || musicRootPath.trim().isEmpty()) {
            log.error("未配置音乐库根目录 (music.rootPath)");
            return false;
        }
        if (cacheDurationDays <= 0) {
            log.error("缓存有效期必须大于 0: {}", cacheDurationDays);
            return false;
        }
        if (lockTimeoutSeconds <= 0 || lockWaitSeconds < 0) {
            log.error("锁等待时间配置无效: lockTimeoutSeconds={}, lockWaitSeconds={}", lockTimeoutSeconds, lockWaitSeconds);
            return false;
        }
        if (migrationMaxRetries < 0 || maxBackups < 0) {
            log.error("重试次数或备份数量不能为负数");
            return false;
        }
        if (!Files.isDirectory(getMusicRoot())) {
            log.warn("音乐库根目录不存在: {}", musicRootPath);
        }
        return true;
    }
}
