package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 java.nio.file.Files 的默认实现
 */
public class FilesAlbumMover implements AlbumMover {

    @Override
    public void move(Path source, Path target) throws IOException {
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        // 大小写不同的改名在不区分大小写的文件系统上 exists 也为真
        if (Files.exists(target) && !isSameFile(source, target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.move(source, target);
    }

    @Override
    public void merge(Path source, Path target) throws IOException {
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        Files.createDirectories(target);

        List<Path> files;
        try (Stream<Path> walk = Files.walk(source)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
        for (Path file : files) {
            Path destination = target.resolve(source.relativize(file).toString());
            Path parent = destination.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(file, destination, StandardCopyOption.REPLACE_EXISTING);
        }
        FileSystemUtils.deleteRecursively(source);
    }

    private static boolean isSameFile(Path source, Path target) {
        try {
            return Files.isSameFile(source, target);
        } catch (IOException e) {
            return false;
        }
    }
}
