package com.lux032.musiclibrary.storage;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 清理旧备份的结果
 */
@Data
public class BackupCleanupResult {
    private int backupsRemoved;
    private long bytesFreed;
    private List<String> errors = new ArrayList<>();
}
