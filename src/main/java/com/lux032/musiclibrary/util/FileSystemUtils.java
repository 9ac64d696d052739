package com.lux032.musiclibrary.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 文件系统工具
 */
@Slf4j
public final class FileSystemUtils {

    // 识别为音乐文件的扩展名
    public static final Set<String> MUSIC_EXTENSIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        "mp3", "flac", "wav", "aac", "m4a", "ogg", "wma", "mp4", "m4p"
    )));

    private FileSystemUtils() {
    }

    public static boolean isMusicFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return MUSIC_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 统计目录下（不递归）的音乐文件数量
     */
    public static int countMusicFiles(Path folder) throws IOException {
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && isMusicFile(entry)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * 列出子目录，按名称排序
     */
    public static List<Path> listSubdirectories(Path folder) throws IOException {
        List<Path> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, Files::isDirectory)) {
            for (Path entry : stream) {
                result.add(entry);
            }
        }
        result.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return result;
    }

    public static boolean isEmptyDirectory(Path folder) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            return !stream.iterator().hasNext();
        }
    }

    /**
     * 递归复制目录
     * @param exclude 返回 true 的路径（及其子树）不复制
     * @return [已复制文件数, 跳过文件数]
     */
    public static int[] copyDirectoryRecursively(Path source, Path target, Predicate<Path> exclude) throws IOException {
        int[] counts = new int[2];

        Files.walkFileTree(source, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && exclude.test(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (exclude.test(file)) {
                    counts[1]++;
                    return FileVisitResult.CONTINUE;
                }
                Path targetFile = target.resolve(source.relativize(file).toString());
                Files.copy(file, targetFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                counts[0]++;
                return FileVisitResult.CONTINUE;
            }
        });

        return counts;
    }

    /**
     * 递归删除目录或文件，不存在时直接返回
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * 计算目录总大小（字节）
     * @param exclude 返回 true 的路径（及其子树）不计入
     */
    public static long directorySize(Path folder, Predicate<Path> exclude) throws IOException {
        long[] size = new long[1];
        Files.walkFileTree(folder, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(folder) && exclude.test(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!exclude.test(file)) {
                    size[0] += attrs.size();
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("无法读取文件大小: {} - {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return size[0];
    }

    /**
     * 相对路径，统一使用 / 分隔
     */
    public static String relativePath(Path base, Path path) {
        return base.relativize(path).toString().replace('\\', '/');
    }
}
