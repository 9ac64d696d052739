package com.lux032.musiclibrary.migration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 迁移结果
 */
@Data
public class MigrationResult {
    private MigrationStatus status;
    private String bandName;
    private MigrationType migrationType;
    private boolean dryRun;
    private List<MigrationOperation> operations = new ArrayList<>();
    private int albumsMigrated;
    private int albumsFailed;
    private List<String> skippedAlbums = new ArrayList<>();
    private double migrationTimeSeconds;
    private BackupInfo backupInfo;
    private boolean rollbackAvailable;
    private List<String> errorMessages = new ArrayList<>();
    private List<RecoveryLogEntry> recoveryLog = new ArrayList<>();

    public MigrationResult() {
    }

    public MigrationResult(String bandName, MigrationType migrationType, boolean dryRun) {
        this.bandName = bandName;
        this.migrationType = migrationType;
        this.dryRun = dryRun;
    }
}
