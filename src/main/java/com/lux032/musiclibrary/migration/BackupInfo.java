package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.model.StructureType;
import lombok.Data;

/**
 * 迁移前的整目录备份
 */
@Data
public class BackupInfo {
    private String timestamp;
    private String bandName;
    private String backupFolderPath;
    private StructureType originalStructureType;
    private String metadataBackupPath;
    private int filesBackedUp;
}
