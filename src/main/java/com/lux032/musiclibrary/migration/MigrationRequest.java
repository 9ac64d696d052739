package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.model.AlbumType;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 迁移参数
 */
@Data
public class MigrationRequest {
    private String bandName;
    private MigrationType migrationType;
    private boolean dryRun;
    // 键是专辑名或文件夹名（忽略大小写）
    private Map<String, AlbumType> albumTypeOverrides = new LinkedHashMap<>();
    private boolean backupOriginal = true;
    private boolean force;
    // 专辑名或文件夹名（忽略大小写）
    private List<String> excludeAlbums = new ArrayList<>();

    public MigrationRequest() {
    }

    public MigrationRequest(String bandName, MigrationType migrationType) {
        this.bandName = bandName;
        this.migrationType = migrationType;
    }
}
