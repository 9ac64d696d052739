package com.lux032.musiclibrary.migration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 专辑目录的移动操作
 */
public interface AlbumMover {

    /**
     * 移动目录，目标已存在时抛出 FileAlreadyExistsException
     */
    void move(Path source, Path target) throws IOException;

    /**
     * 把 source 的内容合并进已存在的 target，同名文件以 source 为准，然后删除 source
     */
    void merge(Path source, Path target) throws IOException;
}
