package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.util.FileSystemUtils;
import com.lux032.musiclibrary.util.LibraryLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 在乐队目录下查找专辑文件夹
 * 类型文件夹（Album/、Live/、Demos/ ...）下的子目录按专辑处理，只保留包含音乐文件的目录
 */
@Slf4j
public class AlbumFolderLocator {

    private final AlbumFolderParser parser;

    public AlbumFolderLocator(AlbumFolderParser parser) {
        this.parser = parser;
    }

    /**
     * @param errors 单个类型文件夹或专辑文件夹读取失败时追加错误信息，不中断查找
     */
    public List<DiscoveredAlbum> discover(Path bandFolder, List<String> errors) throws IOException {
        List<DiscoveredAlbum> albums = new ArrayList<>();
        for (Path child : FileSystemUtils.listSubdirectories(bandFolder)) {
            if (LibraryLayout.isExcludedFolder(child)) {
                continue;
            }
            String childName = child.getFileName().toString();
            if (AlbumType.fromTypeFolderName(childName) != null) {
                try {
                    for (Path albumFolder : FileSystemUtils.listSubdirectories(child)) {
                        if (!LibraryLayout.isExcludedFolder(albumFolder)) {
                            addIfMusic(bandFolder, albumFolder, childName, albums, errors);
                        }
                    }
                } catch (IOException e) {
                    log.warn("无法读取类型文件夹: {} - {}", child, e.getMessage());
                    errors.add(bandFolder.getFileName() + "/" + childName + ": " + e.getMessage());
                }
                // 类型文件夹本身直接放音乐文件时也按专辑处理
                addIfMusic(bandFolder, child, null, albums, errors);
            } else {
                addIfMusic(bandFolder, child, null, albums, errors);
            }
        }
        albums.sort((a, b) -> a.getFolderPath().compareToIgnoreCase(b.getFolderPath()));
        return albums;
    }

    private void addIfMusic(Path bandFolder, Path albumFolder, String typeFolder,
                            List<DiscoveredAlbum> albums, List<String> errors) {
        int tracks;
        try {
            tracks = FileSystemUtils.countMusicFiles(albumFolder);
        } catch (IOException e) {
            log.warn("无法读取专辑文件夹: {} - {}", albumFolder, e.getMessage());
            errors.add(FileSystemUtils.relativePath(bandFolder.getParent(), albumFolder) + ": " + e.getMessage());
            return;
        }
        if (tracks == 0) {
            return;
        }
        ParsedAlbumFolder parsed = parser.parse(albumFolder.getFileName().toString(), typeFolder);
        albums.add(new DiscoveredAlbum(albumFolder, FileSystemUtils.relativePath(bandFolder, albumFolder),
            typeFolder, parsed, tracks));
    }
}
