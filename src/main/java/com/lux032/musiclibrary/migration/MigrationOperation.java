package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.model.AlbumType;
import lombok.Data;

/**
 * 单个专辑的移动/改名操作，路径相对乐队目录
 */
@Data
public class MigrationOperation {
    private String albumName;
    private String sourcePath;
    private String targetPath;
    private AlbumType albumType;
    private String year = "";
    private String edition = "";
    private OperationType operationType;
    private boolean completed;
    private String errorMessage;

    public MigrationOperation() {
    }

    public MigrationOperation(String albumName, String sourcePath, String targetPath, AlbumType albumType,
                              OperationType operationType) {
        this.albumName = albumName;
        this.sourcePath = sourcePath;
        this.targetPath = targetPath;
        this.albumType = albumType;
        this.operationType = operationType;
    }
}
