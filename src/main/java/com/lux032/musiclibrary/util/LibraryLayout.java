package com.lux032.musiclibrary.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 音乐库目录约定
 */
public final class LibraryLayout {

    public static final String MIGRATION_BACKUP_PREFIX = ".migration_backup_";

    // 扫描时忽略的目录（小写比较）
    private static final Set<String> EXCLUDED_FOLDERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        "temp", "tmp", "cache", "trash", ".trash", "$recycle.bin", "system volume information",
        "itunes", "windows media player", "winamp",
        "artwork", "covers", "images", "scans", "logs"
    )));

    private LibraryLayout() {
    }

    /**
     * 是否应当跳过的目录: 隐藏目录、回收站、播放器缓存、图片目录等
     */
    public static boolean isExcludedFolder(Path folder) {
        String name = folder.getFileName().toString();
        return name.startsWith(".") || EXCLUDED_FOLDERS.contains(name.toLowerCase(Locale.ROOT));
    }

    public static boolean isMigrationBackup(Path path) {
        return path.getFileName().toString().startsWith(MIGRATION_BACKUP_PREFIX);
    }

    /**
     * 列出根目录下的乐队目录，按名称排序
     */
    public static List<Path> listBandFolders(Path musicRoot) throws IOException {
        List<Path> bands = new ArrayList<>();
        for (Path folder : FileSystemUtils.listSubdirectories(musicRoot)) {
            if (!isExcludedFolder(folder)) {
                bands.add(folder);
            }
        }
        return bands;
    }
}
