package com.lux032.musiclibrary.migration;

import lombok.Data;

/**
 * 恢复日志条目
 */
@Data
public class RecoveryLogEntry {
    private final String timestamp;
    private final String bandName;
    private final String albumName;
    private final MigrationErrorType errorType;
    private final RecoveryState state;
    private final String message;

    public RecoveryLogEntry(String timestamp, String bandName, String albumName,
                            MigrationErrorType errorType, RecoveryState state, String message) {
        this.timestamp = timestamp;
        this.bandName = bandName;
        this.albumName = albumName;
        this.errorType = errorType;
        this.state = state;
        this.message = message;
    }
}
