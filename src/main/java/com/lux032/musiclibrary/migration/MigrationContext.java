package com.lux032.musiclibrary.migration;

import lombok.Data;

/**
 * 出错时的操作上下文
 */
@Data
public class MigrationContext {
    private String bandName;
    private String albumName;
    private String sourcePath;
    private String targetPath;
    private boolean rollbackAvailable;
    private boolean force;

    public MigrationContext() {
    }

    public MigrationContext(String bandName, MigrationOperation operation, boolean rollbackAvailable, boolean force) {
        this.bandName = bandName;
        this.albumName = operation.getAlbumName();
        this.sourcePath = operation.getSourcePath();
        this.targetPath = operation.getTargetPath();
        this.rollbackAvailable = rollbackAvailable;
        this.force = force;
    }
}
