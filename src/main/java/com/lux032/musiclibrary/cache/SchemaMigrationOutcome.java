package com.lux032.musiclibrary.cache;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个文档的结构升级结果
 */
@Data
public class SchemaMigrationOutcome {
    private String targetVersion;
    private List<String> changes = new ArrayList<>();
    private String backupPath;

    public SchemaMigrationOutcome() {
    }

    public SchemaMigrationOutcome(String targetVersion, List<String> changes) {
        this.targetVersion = targetVersion;
        this.changes = new ArrayList<>(changes);
    }

    public boolean isChanged() {
        return !changes.isEmpty();
    }
}
