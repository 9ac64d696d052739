package com.lux032.musiclibrary.migration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 迁移计划: 按顺序执行的操作，以及不参与迁移的专辑和原因
 */
@Data
public class MigrationPlan {
    private List<MigrationOperation> operations = new ArrayList<>();
    private List<String> skippedAlbums = new ArrayList<>();

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
