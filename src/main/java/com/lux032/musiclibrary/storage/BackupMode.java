package com.lux032.musiclibrary.storage;

/**
 * 写入前的备份方式
 */
public enum BackupMode {
    NONE,
    SIDECAR,      // 覆盖 <file>.backup
    TIMESTAMPED   // 新建 <file>.backup_<时间戳>
}
