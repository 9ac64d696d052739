package com.lux032.musiclibrary.migration;

/**
 * 迁移进度回调，每个操作完成后调用一次
 */
@FunctionalInterface
public interface MigrationProgressListener {

    MigrationProgressListener NONE = (message, percentage) -> { };

    void onProgress(String message, double percentage);
}
