package com.lux032.musiclibrary.cache;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 整个收藏的结构升级结果
 */
@Data
public class SchemaMigrationReport {
    private String targetVersion;
    private int documentsChecked;
    private int documentsMigrated;
    private boolean indexMigrated;
    private List<String> migratedBands = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
}
